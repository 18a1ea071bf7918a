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

/**
 * A projection of one document type across events of many streams, grouped in a user-defined way.
 *
 * @param <D> the document type
 * @param <I> the identity type of the document
 */
public interface MultiStreamProjection<D, I> {
    String getName();

    Class<D> getDocumentClass();

    Class<I> getIdentityClass();

    void configure(ProjectionBuilder<D, I> builder);
}
