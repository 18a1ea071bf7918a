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

package org.elasticsoftware.eventslicer.slicing;

import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.DomainEventType;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.EnvelopeFanOutFunction;
import org.elasticsoftware.eventslicer.projections.FanOutFunction;
import org.elasticsoftware.eventslicer.projections.FanOutMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

public record FanOutRule<E extends DomainEvent, C extends DomainEvent>(Class<E> sourceType,
                                                                       DomainEventType<C> childType,
                                                                       EnvelopeFanOutFunction<E, C> function,
                                                                       FanOutMode mode) {

    public static <E extends DomainEvent, C extends DomainEvent> FanOutRule<E, C> of(Class<E> sourceType,
                                                                                     Class<C> childType,
                                                                                     FanOutFunction<E, C> function,
                                                                                     FanOutMode mode) {
        return new FanOutRule<>(sourceType, DomainEventType.of(childType), event -> function.apply(event.payload()), mode);
    }

    public static <E extends DomainEvent, C extends DomainEvent> FanOutRule<E, C> ofEnvelope(Class<E> sourceType,
                                                                                             Class<C> childType,
                                                                                             EnvelopeFanOutFunction<E, C> function,
                                                                                             FanOutMode mode) {
        return new FanOutRule<>(sourceType, DomainEventType.of(childType), function, mode);
    }

    public boolean appliesTo(StreamEvent<?> event) {
        return event.payload().getClass() == sourceType;
    }

    /**
     * Creates the synthetic children of {@code parent}, in the order the function produced them. The fan-out
     * index of the children is provisional and assigned by the {@link FanOutExpander}.
     */
    @SuppressWarnings("unchecked")
    public List<StreamEvent<?>> children(StreamEvent<?> parent) {
        List<StreamEvent<?>> children = new ArrayList<>();
        try (Stream<C> payloads = function.apply((StreamEvent<E>) parent)) {
            if (payloads == null) {
                return children;
            }
            payloads.filter(Objects::nonNull)
                    .forEach(payload -> children.add(parent.child(childTypeOf(payload), payload, 1)));
        }
        return children;
    }

    @SuppressWarnings("unchecked")
    private DomainEventType<C> childTypeOf(C payload) {
        return payload.getClass() == childType.typeClass() ? childType : DomainEventType.of((Class<C>) payload.getClass());
    }
}
