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

package org.elasticsoftware.eventslicer.kafka;

import org.elasticsoftware.eventslicer.projections.QuerySession;
import org.elasticsoftware.eventslicer.slicing.TenantSliceGroup;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The document store a projection writes its slices to. Slices and consumer offsets are handed over
 * together, so a store that applies both atomically resumes exactly after the last applied batch.
 *
 * @param <I> the identity type of the projected documents
 */
public interface ProjectionStore<I> {
    /**
     * Opens a session that custom groupers can use to look up existing documents. The caller closes it
     * once the batch is sliced.
     */
    QuerySession openSession();

    /**
     * Returns the last applied offset for each of the given partition ids. Partitions that were never
     * applied are left out.
     */
    Map<String, Long> getOffsets(Set<String> partitionIds);

    void apply(String projectionName, List<TenantSliceGroup<I>> groups, Map<String, Long> offsets) throws IOException;
}
