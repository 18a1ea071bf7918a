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
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.IdentitiesFunction;
import org.elasticsoftware.eventslicer.projections.IdentityFunction;

import java.util.*;

/**
 * The identity rules of a projection, keyed by the exact payload class of an event. Several rules for the
 * same class are additive.
 */
public final class IdentityRules<I> {
    private final Map<Class<?>, List<IdentityRule<I>>> rules;

    private IdentityRules(Map<Class<?>, List<IdentityRule<I>>> rules) {
        this.rules = rules;
    }

    /**
     * Adds the identities claimed by the rules for the event's payload type to {@code identities}.
     * Events without a rule add nothing.
     */
    public void collectIdentities(StreamEvent<?> event, Collection<I> identities) {
        List<IdentityRule<I>> eventRules = rules.get(event.payload().getClass());
        if (eventRules != null) {
            for (IdentityRule<I> rule : eventRules) {
                rule.collect(event.payload(), identities);
            }
        }
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public Set<Class<? extends DomainEvent>> getEventTypes() {
        Set<Class<? extends DomainEvent>> eventTypes = new LinkedHashSet<>();
        rules.keySet().forEach(type -> eventTypes.add((Class<? extends DomainEvent>) type));
        return eventTypes;
    }

    @FunctionalInterface
    private interface IdentityRule<I> {
        void collect(DomainEvent event, Collection<I> identities);
    }

    public static class Builder<I> {
        private final Map<Class<?>, List<IdentityRule<I>>> rules = new LinkedHashMap<>();

        @SuppressWarnings("unchecked")
        public <E extends DomainEvent> Builder<I> addIdentity(Class<E> eventClass, IdentityFunction<E, I> identityFunction) {
            return addRule(eventClass, (event, identities) -> {
                I identity = identityFunction.apply((E) event);
                if (identity != null) {
                    identities.add(identity);
                }
            });
        }

        @SuppressWarnings("unchecked")
        public <E extends DomainEvent> Builder<I> addIdentities(Class<E> eventClass, IdentitiesFunction<E, I> identitiesFunction) {
            return addRule(eventClass, (event, identities) -> {
                List<I> claimed = identitiesFunction.apply((E) event);
                if (claimed != null) {
                    claimed.stream().filter(Objects::nonNull).forEach(identities::add);
                }
            });
        }

        public boolean isEmpty() {
            return rules.isEmpty();
        }

        private Builder<I> addRule(Class<?> eventClass, IdentityRule<I> rule) {
            rules.computeIfAbsent(eventClass, k -> new ArrayList<>()).add(rule);
            return this;
        }

        public IdentityRules<I> build() {
            Map<Class<?>, List<IdentityRule<I>>> copy = new LinkedHashMap<>();
            rules.forEach((type, typeRules) -> copy.put(type, List.copyOf(typeRules)));
            return new IdentityRules<>(Collections.unmodifiableMap(copy));
        }
    }
}
