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

import com.google.common.util.concurrent.MoreExecutors;
import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.AggregateGrouper;
import org.elasticsoftware.eventslicer.projections.IdentityClaim;
import org.elasticsoftware.eventslicer.projections.QuerySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the custom groupers of a projection against a batch and merges their claims. Groupers are started
 * on the configured executor and may run concurrently, but the merged result only depends on the
 * registration order of the groupers and the order of their claims.
 */
public final class GrouperChain<I> {
    private static final Logger logger = LoggerFactory.getLogger(GrouperChain.class);
    private final List<AggregateGrouper<I>> groupers;
    private final Executor executor;

    public GrouperChain(List<AggregateGrouper<I>> groupers, Executor executor) {
        this.groupers = List.copyOf(groupers);
        this.executor = executor;
    }

    public GrouperChain(List<AggregateGrouper<I>> groupers) {
        this(groupers, MoreExecutors.directExecutor());
    }

    public boolean isEmpty() {
        return groupers.isEmpty();
    }

    public Set<Class<? extends DomainEvent>> getEventTypes() {
        Set<Class<? extends DomainEvent>> eventTypes = new LinkedHashSet<>();
        groupers.forEach(grouper -> eventTypes.addAll(grouper.getEventTypes()));
        return eventTypes;
    }

    /**
     * Returns, per event instance, the identities claimed for it by any grouper. Waits for all groupers to
     * complete; if one of them fails the failure is rethrown and no claims are returned.
     */
    public Map<StreamEvent<?>, Set<I>> claims(QuerySession querySession, List<StreamEvent<?>> events) throws IOException {
        if (groupers.isEmpty() || events.isEmpty()) {
            return Collections.emptyMap();
        }
        List<CompletableFuture<List<IdentityClaim<I>>>> results = groupers.stream()
                .map(grouper -> CompletableFuture.supplyAsync(() -> runGrouper(grouper, querySession, events), executor))
                .toList();
        try {
            CompletableFuture.allOf(results.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            throw rethrow(e.getCause());
        }
        Set<StreamEvent<?>> batch = Collections.newSetFromMap(new IdentityHashMap<>());
        batch.addAll(events);
        Map<StreamEvent<?>, Set<I>> claims = new IdentityHashMap<>();
        for (CompletableFuture<List<IdentityClaim<I>>> result : results) {
            List<IdentityClaim<I>> grouperClaims = result.join();
            if (grouperClaims == null) {
                continue;
            }
            for (IdentityClaim<I> claim : grouperClaims) {
                if (claim.identity() == null) {
                    continue;
                }
                for (StreamEvent<?> event : claim.events()) {
                    if (batch.contains(event)) {
                        claims.computeIfAbsent(event, k -> new LinkedHashSet<>()).add(claim.identity());
                    } else {
                        logger.warn("Ignoring claim of identity {} for event {}@{} which is not part of the batch",
                                claim.identity(), event.streamId(), event.sequence());
                    }
                }
            }
        }
        return claims;
    }

    private List<IdentityClaim<I>> runGrouper(AggregateGrouper<I> grouper,
                                              QuerySession querySession,
                                              List<StreamEvent<?>> events) {
        try {
            return grouper.group(querySession, events);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static IOException rethrow(Throwable cause) throws IOException {
        if (cause instanceof UncheckedIOException e) {
            throw e.getCause();
        } else if (cause instanceof RuntimeException e) {
            throw e;
        } else if (cause instanceof Error e) {
            throw e;
        } else {
            throw new IOException("Grouper failed", cause);
        }
    }
}
