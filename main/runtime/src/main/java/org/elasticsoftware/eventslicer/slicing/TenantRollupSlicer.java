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
import org.elasticsoftware.eventslicer.projections.QuerySession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Groups events by tenant id only, producing one slice per tenant whose identity is the tenant id. Used
 * to roll up summaries per tenant in a conjoined multi-tenant event store.
 */
public class TenantRollupSlicer implements EventSlicer<String> {
    private final String projectionName;
    private final FanOutExpander fanOutExpander;

    public TenantRollupSlicer(String projectionName, FanOutExpander fanOutExpander) {
        this.projectionName = projectionName;
        this.fanOutExpander = fanOutExpander;
    }

    /**
     * Inline application works on one stream at a time and cannot roll up across streams.
     *
     * @throws UnsupportedSlicingModeException always
     */
    @Override
    public List<EventSlice<String>> sliceInlineActions(QuerySession querySession, List<StreamAction> streams) {
        throw new UnsupportedSlicingModeException(projectionName,
                "Rolling up by tenant id is not supported for inline projections");
    }

    @Override
    public List<TenantSliceGroup<String>> sliceAsyncEvents(QuerySession querySession, List<StreamEvent<?>> events) {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        List<StreamEvent<?>> expanded = fanOutExpander.expandBeforeGrouping(events);
        List<TenantSliceGroup<String>> groups = new ArrayList<>();
        for (Map.Entry<String, List<StreamEvent<?>>> tenantEvents : DefaultEventSlicer.partitionByTenant(expanded).entrySet()) {
            String tenantId = tenantEvents.getKey();
            EventSlice<String> slice = new EventSlice<>(tenantId, tenantId,
                    fanOutExpander.expandAfterGrouping(tenantEvents.getValue()));
            groups.add(new TenantSliceGroup<>(tenantId, List.of(slice)));
        }
        return groups;
    }

    @Override
    public String toString() {
        return "TenantRollupSlicer{" + projectionName + "}";
    }
}
