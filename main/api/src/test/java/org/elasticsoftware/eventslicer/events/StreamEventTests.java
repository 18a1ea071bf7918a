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

import org.elasticsoftware.eventslicer.store.Tenancy;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class StreamEventTests {

    record Deposited(String accountId, long amount) implements DomainEvent {
    }

    record Booked(String ledger) implements DomainEvent {
    }

    private final Instant timestamp = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    public void testMissingTenantMeansTheDefaultTenant() {
        StreamEvent<Deposited> event = StreamEvent.of("account-1", null, 4, new Deposited("account-1", 100), timestamp);

        assertEquals(Tenancy.DEFAULT_TENANT_ID, event.tenantId());
        assertFalse(event.isSynthetic());
        assertEquals(Deposited.class, event.payloadType());
    }

    @Test
    public void testChildrenInheritTheParentPosition() {
        StreamEvent<Deposited> parent = StreamEvent.of("account-1", "tenant-1", 4, new Deposited("account-1", 100), timestamp);

        StreamEvent<Booked> child = parent.child(DomainEventType.of(Booked.class), new Booked("cash"), 2);

        assertEquals("account-1", child.streamId());
        assertEquals("tenant-1", child.tenantId());
        assertEquals(4L, child.sequence());
        assertEquals(timestamp, child.timestamp());
        assertEquals(2, child.fanOutIndex());
        assertTrue(child.isSynthetic());
        assertEquals(new Booked("cash"), child.payload());
    }

    @Test
    public void testRenumberingOnlyCopiesWhenTheIndexChanges() {
        StreamEvent<Deposited> parent = StreamEvent.of("account-1", "tenant-1", 4, new Deposited("account-1", 100), timestamp);
        StreamEvent<Booked> child = parent.child(DomainEventType.of(Booked.class), new Booked("cash"), 1);

        assertSame(child, child.withFanOutIndex(1));
        assertEquals(3, child.withFanOutIndex(3).fanOutIndex());
    }
}
