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

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Read-only access to already materialized documents, handed to groupers that need a lookup to decide
 * which documents an event belongs to.
 * <p>
 * Sessions are opened per batch and closed once the batch is sliced. Closing a session also releases the
 * tenant scoped sessions obtained from it.
 */
public interface QuerySession extends Closeable {
    String getTenantId();

    <D> Optional<D> load(Class<D> documentType, Object id) throws IOException;

    /**
     * Returns a session scoped to the given tenant.
     */
    QuerySession forTenant(String tenantId);
}
