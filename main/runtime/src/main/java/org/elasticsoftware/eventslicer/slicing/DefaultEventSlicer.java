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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Slices events using the identity rules and custom groupers of a projection.
 * <p>
 * Events are partitioned by tenant, keeping their relative order. Within a tenant every event is added
 * to the slice of each identity claimed for it by a rule or a grouper, once per identity. Tenants and
 * slices are emitted in the order they were first seen.
 */
public class DefaultEventSlicer<I> implements EventSlicer<I> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEventSlicer.class);
    private final String projectionName;
    private final IdentityRules<I> identityRules;
    private final GrouperChain<I> grouperChain;
    private final FanOutExpander fanOutExpander;

    public DefaultEventSlicer(String projectionName,
                              IdentityRules<I> identityRules,
                              GrouperChain<I> grouperChain,
                              FanOutExpander fanOutExpander) {
        this.projectionName = projectionName;
        this.identityRules = identityRules;
        this.grouperChain = grouperChain;
        this.fanOutExpander = fanOutExpander;
    }

    @Override
    public List<EventSlice<I>> sliceInlineActions(QuerySession querySession, List<StreamAction> streams) throws IOException {
        List<StreamEvent<?>> events = streams.stream()
                .flatMap(action -> action.events().stream())
                .toList();
        return sliceAsyncEvents(querySession, events).stream()
                .flatMap(group -> group.slices().stream())
                .toList();
    }

    @Override
    public List<TenantSliceGroup<I>> sliceAsyncEvents(QuerySession querySession, List<StreamEvent<?>> events) throws IOException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        List<StreamEvent<?>> expanded = fanOutExpander.expandBeforeGrouping(events);
        List<TenantSliceGroup<I>> groups = new ArrayList<>();
        for (Map.Entry<String, List<StreamEvent<?>>> tenantEvents : partitionByTenant(expanded).entrySet()) {
            TenantSliceGroup<I> group = sliceTenant(querySession, tenantEvents.getKey(), tenantEvents.getValue());
            if (!group.slices().isEmpty()) {
                groups.add(group);
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Projection {} sliced {} events ({} after fan out) into {} tenant groups",
                    projectionName, events.size(), expanded.size(), groups.size());
        }
        return groups;
    }

    private TenantSliceGroup<I> sliceTenant(QuerySession querySession,
                                            String tenantId,
                                            List<StreamEvent<?>> events) throws IOException {
        Map<StreamEvent<?>, Set<I>> grouperClaims = grouperChain.claims(
                querySession != null ? querySession.forTenant(tenantId) : null,
                events);
        Map<I, List<StreamEvent<?>>> sliceEvents = new LinkedHashMap<>();
        for (StreamEvent<?> event : events) {
            Set<I> identities = new LinkedHashSet<>();
            identityRules.collectIdentities(event, identities);
            identities.addAll(grouperClaims.getOrDefault(event, Collections.emptySet()));
            for (I identity : identities) {
                sliceEvents.computeIfAbsent(identity, k -> new ArrayList<>()).add(event);
            }
        }
        List<EventSlice<I>> slices = new ArrayList<>(sliceEvents.size());
        sliceEvents.forEach((identity, identityEvents) ->
                slices.add(new EventSlice<>(tenantId, identity, fanOutExpander.expandAfterGrouping(identityEvents))));
        return new TenantSliceGroup<>(tenantId, slices);
    }

    static Map<String, List<StreamEvent<?>>> partitionByTenant(List<StreamEvent<?>> events) {
        Map<String, List<StreamEvent<?>>> partitions = new LinkedHashMap<>();
        for (StreamEvent<?> event : events) {
            partitions.computeIfAbsent(event.tenantId(), k -> new ArrayList<>()).add(event);
        }
        return partitions;
    }

    @Override
    public String toString() {
        return "DefaultEventSlicer{" + projectionName + "}";
    }
}
