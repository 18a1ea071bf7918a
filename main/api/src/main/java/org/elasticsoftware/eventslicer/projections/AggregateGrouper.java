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
import org.elasticsoftware.eventslicer.events.StreamEvent;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Assigns events to identities by looking at a whole batch at once, for groupings that cannot be derived
 * from a single event (for instance because they need a lookup through the {@link QuerySession}).
 * <p>
 * Claims must reference the event instances that were passed in. Groupers are additive with identity
 * rules and with each other.
 *
 * @param <I> the identity type
 */
@FunctionalInterface
public interface AggregateGrouper<I> {
    List<IdentityClaim<I>> group(QuerySession querySession, List<StreamEvent<?>> events) throws IOException;

    /**
     * The event types this grouper needs delivered, added to the event types of the projection.
     */
    default Set<Class<? extends DomainEvent>> getEventTypes() {
        return Set.of();
    }
}
