/*
 * Copyright 2022 - 2026 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.eventslicer.projections;

import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.DomainEventType;
import org.elasticsoftware.eventslicer.slicing.EventSlicer;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A validated projection configuration. Immutable and safe to share between slicing threads.
 */
public record CompiledProjection<D, I>(String name,
                                       Class<D> documentClass,
                                       Class<I> identityClass,
                                       GroupingStrategy groupingStrategy,
                                       EventSlicer<I> slicer,
                                       Set<Class<? extends DomainEvent>> eventTypes) {
    public CompiledProjection {
        eventTypes = Set.copyOf(eventTypes);
    }

    /**
     * The event types this projection wants delivered, used to filter the subscription upstream.
     */
    public Collection<DomainEventType<?>> getDomainEventTypes() {
        List<DomainEventType<?>> types = eventTypes.stream()
                .<DomainEventType<?>>map(DomainEventType::of)
                .toList();
        return types;
    }

    public boolean handlesEventType(Class<?> eventClass) {
        return eventTypes.contains(eventClass);
    }
}
