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

import org.elasticsoftware.eventslicer.events.StreamEvent;

import java.util.List;

/**
 * All events of one batch destined for the document identified by {@code identity} within {@code tenantId},
 * in arrival order.
 */
public record EventSlice<I>(String tenantId, I identity, List<StreamEvent<?>> events) {
    public EventSlice {
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
