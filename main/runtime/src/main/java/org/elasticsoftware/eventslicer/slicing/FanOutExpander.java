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

import com.google.common.annotations.VisibleForTesting;
import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.FanOutMode;

import java.util.*;

/**
 * Inserts the children produced by fan-out rules directly behind their parent event. Children are expanded
 * again by any rule of the same mode that matches their type, depth first, so the order of a parent's
 * descendants follows the registration order of the rules.
 */
public final class FanOutExpander {
    @VisibleForTesting
    static final int MAX_DEPTH = 16;
    private final List<FanOutRule<?, ?>> beforeGrouping;
    private final List<FanOutRule<?, ?>> afterGrouping;

    public FanOutExpander(List<FanOutRule<?, ?>> rules) {
        this.beforeGrouping = rules.stream().filter(rule -> rule.mode() == FanOutMode.BEFORE_GROUPING).toList();
        this.afterGrouping = rules.stream().filter(rule -> rule.mode() == FanOutMode.AFTER_GROUPING).toList();
    }

    public static FanOutExpander none() {
        return new FanOutExpander(List.of());
    }

    public boolean isEmpty() {
        return beforeGrouping.isEmpty() && afterGrouping.isEmpty();
    }

    public Set<Class<? extends DomainEvent>> getSourceTypes() {
        Set<Class<? extends DomainEvent>> sourceTypes = new LinkedHashSet<>();
        beforeGrouping.forEach(rule -> sourceTypes.add(rule.sourceType()));
        afterGrouping.forEach(rule -> sourceTypes.add(rule.sourceType()));
        return sourceTypes;
    }

    public List<StreamEvent<?>> expandBeforeGrouping(List<StreamEvent<?>> events) {
        return expand(beforeGrouping, events);
    }

    /**
     * Expands the events of one slice. Every call creates new child instances, so slices sharing a parent
     * do not share children.
     */
    public List<StreamEvent<?>> expandAfterGrouping(List<StreamEvent<?>> sliceEvents) {
        return expand(afterGrouping, sliceEvents);
    }

    private static List<StreamEvent<?>> expand(List<FanOutRule<?, ?>> rules, List<StreamEvent<?>> events) {
        if (rules.isEmpty() || events.isEmpty()) {
            return events;
        }
        List<StreamEvent<?>> expanded = new ArrayList<>(events.size());
        for (StreamEvent<?> event : events) {
            expandInto(rules, event, expanded, 0);
        }
        return expanded.size() == events.size() ? events : renumber(events, expanded);
    }

    private static void expandInto(List<FanOutRule<?, ?>> rules,
                                   StreamEvent<?> event,
                                   List<StreamEvent<?>> expanded,
                                   int depth) {
        expanded.add(event);
        for (FanOutRule<?, ?> rule : rules) {
            if (rule.appliesTo(event)) {
                if (depth >= MAX_DEPTH) {
                    throw new IllegalStateException("Fan out of " + event.eventType().typeName() +
                            " exceeds the maximum depth of " + MAX_DEPTH + ", check for cyclic fan out rules");
                }
                for (StreamEvent<?> child : rule.children(event)) {
                    expandInto(rules, child, expanded, depth + 1);
                }
            }
        }
    }

    /**
     * Numbers the children created by this expansion behind each durable position, continuing after the highest
     * index already present for that position. Synthetic events that were part of the input keep their index.
     */
    private static List<StreamEvent<?>> renumber(List<StreamEvent<?>> input, List<StreamEvent<?>> expanded) {
        Set<StreamEvent<?>> existing = Collections.newSetFromMap(new IdentityHashMap<>());
        existing.addAll(input);
        Map<Position, Integer> counters = new HashMap<>();
        for (StreamEvent<?> event : input) {
            if (event.isSynthetic()) {
                counters.merge(Position.of(event), event.fanOutIndex(), Math::max);
            }
        }
        List<StreamEvent<?>> numbered = new ArrayList<>(expanded.size());
        for (StreamEvent<?> event : expanded) {
            if (existing.contains(event)) {
                numbered.add(event);
            } else {
                numbered.add(event.withFanOutIndex(counters.merge(Position.of(event), 1, Integer::sum)));
            }
        }
        return numbered;
    }

    private record Position(String tenantId, String streamId, long sequence) {
        static Position of(StreamEvent<?> event) {
            return new Position(event.tenantId(), event.streamId(), event.sequence());
        }
    }
}
