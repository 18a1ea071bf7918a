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

import org.elasticsoftware.eventslicer.EventSlicerException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a projection is built with an incomplete or contradictory configuration. Carries every
 * problem that was found, not only the first one.
 */
public class InvalidProjectionException extends EventSlicerException {
    private final List<ProjectionConfigurationError> errors;

    public InvalidProjectionException(String projectionName, List<ProjectionConfigurationError> errors) {
        super(projectionName, formatMessage(projectionName, errors));
        this.errors = List.copyOf(errors);
    }

    public List<ProjectionConfigurationError> getErrors() {
        return errors;
    }

    public boolean hasError(ConfigurationErrorKind kind) {
        return errors.stream().anyMatch(error -> error.kind() == kind);
    }

    private static String formatMessage(String projectionName, List<ProjectionConfigurationError> errors) {
        return "Projection " + projectionName + " has " + errors.size() + " configuration error(s):" +
                errors.stream().map(error -> "\n - " + error).collect(Collectors.joining());
    }
}
