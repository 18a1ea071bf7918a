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

package org.elasticsoftware.eventslicer.store;

import jakarta.validation.constraints.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of the document store and event store configuration a projection is validated against.
 */
public record StoreOptions(@NotNull TenancyStyle eventTenancyStyle,
                           @NotNull Map<Class<?>, DocumentMapping> documentMappings) {

    public StoreOptions {
        documentMappings = Map.copyOf(documentMappings);
    }

    public Optional<DocumentMapping> mappingFor(Class<?> documentType) {
        return Optional.ofNullable(documentMappings.get(documentType));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Class<?>, DocumentMapping> documentMappings = new HashMap<>();
        private TenancyStyle eventTenancyStyle = TenancyStyle.SINGLE;

        public Builder setEventTenancyStyle(TenancyStyle eventTenancyStyle) {
            this.eventTenancyStyle = eventTenancyStyle;
            return this;
        }

        public Builder addDocumentMapping(Class<?> documentType, Class<?> idType, TenancyStyle tenancyStyle) {
            this.documentMappings.put(documentType, new DocumentMapping(documentType, idType, tenancyStyle));
            return this;
        }

        public Builder addDocumentMapping(Class<?> documentType, Class<?> idType) {
            return addDocumentMapping(documentType, idType, TenancyStyle.SINGLE);
        }

        public StoreOptions build() {
            return new StoreOptions(eventTenancyStyle, documentMappings);
        }
    }
}
