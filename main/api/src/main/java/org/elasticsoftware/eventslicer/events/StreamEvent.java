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

package org.elasticsoftware.eventslicer.events;

import jakarta.annotation.Nonnull;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventslicer.store.Tenancy;

import java.time.Instant;

/**
 * An event read from a stream, together with its envelope metadata.
 * <p>
 * Durable events have a {@code fanOutIndex} of 0. Events synthesized by a fan-out rule share the
 * sequence of the durable event they descend from and are numbered 1..n in the order they follow it,
 * so {@code (sequence, fanOutIndex)} is a stable position within the stream. Synthetic events are never
 * persisted.
 *
 * @param <E> the payload type
 */
public record StreamEvent<E extends DomainEvent>(
        @NotNull String streamId,
        @NotNull String tenantId,
        long sequence,
        int fanOutIndex,
        @NotNull DomainEventType<E> eventType,
        @NotNull E payload,
        Instant timestamp
) {
    public StreamEvent {
        if (tenantId == null) {
            tenantId = Tenancy.DEFAULT_TENANT_ID;
        }
    }

    public static <E extends DomainEvent> StreamEvent<E> of(String streamId,
                                                           String tenantId,
                                                           long sequence,
                                                           @Nonnull E payload,
                                                           Instant timestamp) {
        @SuppressWarnings("unchecked")
        DomainEventType<E> type = DomainEventType.of((Class<E>) payload.getClass());
        return new StreamEvent<>(streamId, tenantId, sequence, 0, type, payload, timestamp);
    }

    public boolean isSynthetic() {
        return fanOutIndex > 0;
    }

    public Class<E> payloadType() {
        return eventType.typeClass();
    }

    /**
     * Creates a synthetic child of this event that inherits stream, tenant, sequence and timestamp.
     */
    public <C extends DomainEvent> StreamEvent<C> child(@Nonnull DomainEventType<C> childType,
                                                        @Nonnull C childPayload,
                                                        int childIndex) {
        return new StreamEvent<>(streamId, tenantId, sequence, childIndex, childType, childPayload, timestamp);
    }

    public StreamEvent<E> withFanOutIndex(int index) {
        return index == fanOutIndex ? this
                : new StreamEvent<>(streamId, tenantId, sequence, index, eventType, payload, timestamp);
    }
}
