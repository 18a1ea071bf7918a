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

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventslicer.store.DocumentMapping;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.elasticsoftware.eventslicer.store.TenancyStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.elasticsoftware.eventslicer.projections.ConfigurationErrorKind.*;

/**
 * Checks a projection configuration against the store it is going to be applied to. All problems are
 * collected, nothing is thrown here.
 * <p>
 * A custom slicer decides on tenancy itself, so the tenancy of the document is not checked for it.
 */
public final class ProjectionValidator {

    public List<ProjectionConfigurationError> validate(String projectionName,
                                                       Class<?> documentClass,
                                                       Class<?> identityClass,
                                                       @Nullable GroupingStrategy groupingStrategy,
                                                       StoreOptions storeOptions) {
        List<ProjectionConfigurationError> errors = new ArrayList<>();
        if (groupingStrategy == null) {
            errors.add(new ProjectionConfigurationError(MISSING_GROUPING_RULE,
                    "Projection " + projectionName + " has no identity rules, custom groupers or tenant rollup defined " +
                            "and does not know how to identify event membership in the aggregated document " +
                            documentClass.getName()));
        }
        Optional<DocumentMapping> mapping = storeOptions.mappingFor(documentClass);
        if (mapping.isEmpty()) {
            errors.add(new ProjectionConfigurationError(MISSING_DOCUMENT_MAPPING,
                    "No document mapping registered for " + documentClass.getName()));
            return errors;
        }
        if (!mapping.get().idType().equals(identityClass)) {
            errors.add(new ProjectionConfigurationError(IDENTITY_TYPE_MISMATCH,
                    "Id type mismatch. The projection identity type is " + identityClass.getName() +
                            ", but the aggregate document " + documentClass.getName() +
                            " id type is " + mapping.get().idType().getName()));
        }
        if (groupingStrategy != GroupingStrategy.CUSTOM_SLICER
                && mapping.get().tenancyStyle() == TenancyStyle.CONJOINED
                && storeOptions.eventTenancyStyle() != TenancyStyle.CONJOINED) {
            errors.add(new ProjectionConfigurationError(TENANCY_MISMATCH,
                    "Aggregate " + documentClass.getName() + " is multi-tenanted, but the events are not"));
        }
        return errors;
    }
}
