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

import java.io.IOException;
import java.util.List;

/**
 * Splits events into per-identity slices for a projection.
 *
 * @param <I> the identity type of the projected documents
 */
public interface EventSlicer<I> {
    /**
     * Slices the events of a synchronous unit of work. Only single-stream capable strategies support this.
     */
    List<EventSlice<I>> sliceInlineActions(QuerySession querySession, List<StreamAction> streams) throws IOException;

    List<TenantSliceGroup<I>> sliceAsyncEvents(QuerySession querySession, List<StreamEvent<?>> events) throws IOException;
}
