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

package org.elasticsoftware.eventslicer.testevents;

import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.slicing.EventSlice;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.elasticsoftware.eventslicer.store.TenancyStyle;

import java.time.Instant;
import java.util.List;

public final class TestEvents {
    public static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private TestEvents() {
    }

    public static <E extends DomainEvent> StreamEvent<E> event(String tenantId, String streamId, long sequence, E payload) {
        return StreamEvent.of(streamId, tenantId, sequence, payload, NOW.plusSeconds(sequence));
    }

    public static List<Object> payloads(EventSlice<?> slice) {
        return slice.events().stream().<Object>map(StreamEvent::payload).toList();
    }

    public static StoreOptions customerStore() {
        return StoreOptions.builder()
                .setEventTenancyStyle(TenancyStyle.CONJOINED)
                .addDocumentMapping(CustomerSummary.class, String.class, TenancyStyle.CONJOINED)
                .addDocumentMapping(TenantSummary.class, String.class, TenancyStyle.CONJOINED)
                .build();
    }
}
