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

import com.google.common.util.concurrent.MoreExecutors;
import jakarta.annotation.Nullable;
import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.slicing.*;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.Executor;

import static org.elasticsoftware.eventslicer.projections.ConfigurationErrorKind.CONFIGURATION_CONFLICT;

public class DefaultProjectionBuilder<D, I> implements ProjectionBuilder<D, I> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultProjectionBuilder.class);
    private final String name;
    private final Class<D> documentClass;
    private final Class<I> identityClass;
    private final Executor grouperExecutor;
    private final ProjectionValidator validator = new ProjectionValidator();
    private final IdentityRules.Builder<I> identityRules = new IdentityRules.Builder<>();
    private final List<AggregateGrouper<I>> groupers = new ArrayList<>();
    private final List<FanOutRule<?, ?>> fanOutRules = new ArrayList<>();
    private final Set<Class<? extends DomainEvent>> includedEventTypes = new LinkedHashSet<>();
    private final List<ProjectionConfigurationError> conflicts = new ArrayList<>();
    private EventSlicer<I> customSlicer;
    private boolean rollUpByTenant;

    public DefaultProjectionBuilder(String name, Class<D> documentClass, Class<I> identityClass, Executor grouperExecutor) {
        this.name = name;
        this.documentClass = documentClass;
        this.identityClass = identityClass;
        this.grouperExecutor = grouperExecutor;
    }

    public DefaultProjectionBuilder(String name, Class<D> documentClass, Class<I> identityClass) {
        this(name, documentClass, identityClass, MoreExecutors.directExecutor());
    }

    /**
     * Creates a builder for the given projection and lets it register its rules.
     */
    public static <D, I> DefaultProjectionBuilder<D, I> forProjection(MultiStreamProjection<D, I> projection,
                                                                     Executor grouperExecutor) {
        DefaultProjectionBuilder<D, I> builder = new DefaultProjectionBuilder<>(
                projection.getName(),
                projection.getDocumentClass(),
                projection.getIdentityClass(),
                grouperExecutor);
        projection.configure(builder);
        return builder;
    }

    @Override
    public <E extends DomainEvent> DefaultProjectionBuilder<D, I> withIdentity(Class<E> eventClass,
                                                                               IdentityFunction<E, I> identityFunction) {
        if (hasWholeSlicerOverride()) {
            conflict("Identity rule for " + eventClass.getName() + " registered, but " + describeOverride());
        } else {
            identityRules.addIdentity(eventClass, identityFunction);
        }
        return this;
    }

    @Override
    public <E extends DomainEvent> DefaultProjectionBuilder<D, I> withIdentities(Class<E> eventClass,
                                                                                 IdentitiesFunction<E, I> identitiesFunction) {
        if (hasWholeSlicerOverride()) {
            conflict("Identities rule for " + eventClass.getName() + " registered, but " + describeOverride());
        } else {
            identityRules.addIdentities(eventClass, identitiesFunction);
        }
        return this;
    }

    @Override
    public DefaultProjectionBuilder<D, I> withCustomGrouping(AggregateGrouper<I> grouper) {
        if (hasWholeSlicerOverride()) {
            conflict("Custom grouper " + grouper.getClass().getName() + " registered, but " + describeOverride());
        } else {
            groupers.add(grouper);
        }
        return this;
    }

    @Override
    public DefaultProjectionBuilder<D, I> withCustomSlicer(EventSlicer<I> slicer) {
        if (hasWholeSlicerOverride()) {
            conflict("Custom event slicer " + slicer.getClass().getName() + " registered, but " + describeOverride());
        } else if (!identityRules.isEmpty() || !groupers.isEmpty()) {
            conflict("Custom event slicer " + slicer.getClass().getName() +
                    " registered, but the projection already has identity rules or custom groupers");
        } else {
            customSlicer = slicer;
        }
        return this;
    }

    @Override
    public DefaultProjectionBuilder<D, I> rollUpByTenant() {
        if (!String.class.equals(identityClass)) {
            conflict("Rolling up by tenant id requires the identity type to be " + String.class.getName() +
                    ", but it is " + identityClass.getName());
        } else if (hasWholeSlicerOverride()) {
            conflict("Roll up by tenant id requested, but " + describeOverride());
        } else if (!groupers.isEmpty()) {
            conflict("Roll up by tenant id requested, but a custom grouper is already registered for this projection");
        } else if (!identityRules.isEmpty()) {
            conflict("Roll up by tenant id requested, but identity rules are already registered for this projection");
        } else {
            rollUpByTenant = true;
        }
        return this;
    }

    @Override
    public <E extends DomainEvent, C extends DomainEvent> DefaultProjectionBuilder<D, I> withFanOut(Class<E> eventClass,
                                                                                                    Class<C> childClass,
                                                                                                    FanOutFunction<E, C> fanOutFunction,
                                                                                                    FanOutMode mode) {
        fanOutRules.add(FanOutRule.of(eventClass, childClass, fanOutFunction, mode));
        return this;
    }

    @Override
    public <E extends DomainEvent, C extends DomainEvent> DefaultProjectionBuilder<D, I> withEnvelopeFanOut(Class<E> eventClass,
                                                                                                            Class<C> childClass,
                                                                                                            EnvelopeFanOutFunction<E, C> fanOutFunction,
                                                                                                            FanOutMode mode) {
        fanOutRules.add(FanOutRule.ofEnvelope(eventClass, childClass, fanOutFunction, mode));
        return this;
    }

    @Override
    public DefaultProjectionBuilder<D, I> includeEventType(Class<? extends DomainEvent> eventClass) {
        includedEventTypes.add(eventClass);
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompiledProjection<D, I> build(StoreOptions storeOptions) {
        List<ProjectionConfigurationError> errors = new ArrayList<>(conflicts);
        errors.addAll(validator.validate(name, documentClass, identityClass, groupingStrategy(), storeOptions));
        if (!errors.isEmpty()) {
            throw new InvalidProjectionException(name, errors);
        }
        FanOutExpander fanOutExpander = new FanOutExpander(fanOutRules);
        Set<Class<? extends DomainEvent>> eventTypes = new LinkedHashSet<>(includedEventTypes);
        eventTypes.addAll(fanOutExpander.getSourceTypes());
        final GroupingStrategy strategy;
        final EventSlicer<I> slicer;
        if (customSlicer != null) {
            if (!fanOutExpander.isEmpty()) {
                logger.warn("Projection {} uses custom event slicer {}, its fan out rules are not applied by the projection",
                        name, customSlicer);
            }
            strategy = GroupingStrategy.CUSTOM_SLICER;
            slicer = customSlicer;
        } else if (rollUpByTenant) {
            strategy = GroupingStrategy.TENANT_ROLLUP;
            slicer = (EventSlicer<I>) (EventSlicer<?>) new TenantRollupSlicer(name, fanOutExpander);
        } else {
            IdentityRules<I> rules = identityRules.build();
            GrouperChain<I> grouperChain = new GrouperChain<>(groupers, grouperExecutor);
            eventTypes.addAll(rules.getEventTypes());
            eventTypes.addAll(grouperChain.getEventTypes());
            strategy = GroupingStrategy.IDENTITY_RULES;
            slicer = new DefaultEventSlicer<>(name, rules, grouperChain, fanOutExpander);
        }
        logger.info("Built projection {} for document {} using {} grouping, handling {} event types",
                name, documentClass.getSimpleName(), strategy, eventTypes.size());
        return new CompiledProjection<>(name, documentClass, identityClass, strategy, slicer, eventTypes);
    }

    @Nullable
    private GroupingStrategy groupingStrategy() {
        if (customSlicer != null) {
            return GroupingStrategy.CUSTOM_SLICER;
        } else if (rollUpByTenant) {
            return GroupingStrategy.TENANT_ROLLUP;
        } else if (!identityRules.isEmpty() || !groupers.isEmpty()) {
            return GroupingStrategy.IDENTITY_RULES;
        }
        return null;
    }

    private boolean hasWholeSlicerOverride() {
        return customSlicer != null || rollUpByTenant;
    }

    private String describeOverride() {
        return rollUpByTenant ? "this projection already rolls up by tenant id"
                : "there is already a custom event slicer registered for this projection";
    }

    private void conflict(String message) {
        logger.debug("Configuration conflict in projection {}: {}", name, message);
        conflicts.add(new ProjectionConfigurationError(CONFIGURATION_CONFLICT, message));
    }
}
