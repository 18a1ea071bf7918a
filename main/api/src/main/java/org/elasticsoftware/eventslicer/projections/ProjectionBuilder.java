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
import org.elasticsoftware.eventslicer.slicing.EventSlicer;
import org.elasticsoftware.eventslicer.store.StoreOptions;

/**
 * Registration API for a multi-stream projection. Registrations are only recorded; all exclusivity and
 * completeness checks happen together in {@link #build(StoreOptions)}.
 *
 * @param <D> the document type
 * @param <I> the identity type of the document
 */
public interface ProjectionBuilder<D, I> {
    <E extends DomainEvent> ProjectionBuilder<D, I> withIdentity(Class<E> eventClass,
                                                                 IdentityFunction<E, I> identityFunction);

    <E extends DomainEvent> ProjectionBuilder<D, I> withIdentities(Class<E> eventClass,
                                                                   IdentitiesFunction<E, I> identitiesFunction);

    /**
     * Adds a custom grouping strategy. This is additive to the identity rules.
     */
    ProjectionBuilder<D, I> withCustomGrouping(AggregateGrouper<I> grouper);

    /**
     * Replaces the whole slicing pipeline with the given slicer.
     */
    ProjectionBuilder<D, I> withCustomSlicer(EventSlicer<I> slicer);

    /**
     * Groups all events of a tenant into one document identified by the tenant id. Only valid for
     * {@code String} identities, and exclusive with identity rules and groupers.
     */
    ProjectionBuilder<D, I> rollUpByTenant();

    default <E extends DomainEvent, C extends DomainEvent> ProjectionBuilder<D, I> withFanOut(Class<E> eventClass,
                                                                                              Class<C> childClass,
                                                                                              FanOutFunction<E, C> fanOutFunction) {
        return withFanOut(eventClass, childClass, fanOutFunction, FanOutMode.AFTER_GROUPING);
    }

    <E extends DomainEvent, C extends DomainEvent> ProjectionBuilder<D, I> withFanOut(Class<E> eventClass,
                                                                                      Class<C> childClass,
                                                                                      FanOutFunction<E, C> fanOutFunction,
                                                                                      FanOutMode mode);

    default <E extends DomainEvent, C extends DomainEvent> ProjectionBuilder<D, I> withEnvelopeFanOut(Class<E> eventClass,
                                                                                                      Class<C> childClass,
                                                                                                      EnvelopeFanOutFunction<E, C> fanOutFunction) {
        return withEnvelopeFanOut(eventClass, childClass, fanOutFunction, FanOutMode.AFTER_GROUPING);
    }

    <E extends DomainEvent, C extends DomainEvent> ProjectionBuilder<D, I> withEnvelopeFanOut(Class<E> eventClass,
                                                                                              Class<C> childClass,
                                                                                              EnvelopeFanOutFunction<E, C> fanOutFunction,
                                                                                              FanOutMode mode);

    /**
     * Declares an event type the apply step handles without an identity rule of its own, so that it is
     * delivered to the projection.
     */
    ProjectionBuilder<D, I> includeEventType(Class<? extends DomainEvent> eventClass);

    /**
     * Validates the configuration against the store and creates the slicer.
     *
     * @throws InvalidProjectionException listing every configuration problem found
     */
    CompiledProjection<D, I> build(StoreOptions storeOptions);
}
