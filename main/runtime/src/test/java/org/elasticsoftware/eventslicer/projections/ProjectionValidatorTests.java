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

import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.elasticsoftware.eventslicer.store.TenancyStyle;
import org.elasticsoftware.eventslicer.testevents.CustomerSummary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.elasticsoftware.eventslicer.projections.ConfigurationErrorKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProjectionValidatorTests {
    private final ProjectionValidator validator = new ProjectionValidator();

    @Test
    public void testValidConfigurationHasNoErrors() {
        StoreOptions storeOptions = StoreOptions.builder()
                .addDocumentMapping(CustomerSummary.class, String.class)
                .build();

        assertTrue(validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.IDENTITY_RULES, storeOptions).isEmpty());
    }

    @Test
    public void testMissingGroupingRule() {
        StoreOptions storeOptions = StoreOptions.builder()
                .addDocumentMapping(CustomerSummary.class, String.class)
                .build();

        List<ProjectionConfigurationError> errors = validator.validate("customers", CustomerSummary.class, String.class, null, storeOptions);

        assertEquals(1, errors.size());
        assertEquals(MISSING_GROUPING_RULE, errors.get(0).kind());
    }

    @Test
    public void testIdentityTypeMismatchNamesBothTypes() {
        StoreOptions storeOptions = StoreOptions.builder()
                .addDocumentMapping(CustomerSummary.class, UUID.class)
                .build();

        List<ProjectionConfigurationError> errors = validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.IDENTITY_RULES, storeOptions);

        assertEquals(1, errors.size());
        assertEquals(IDENTITY_TYPE_MISMATCH, errors.get(0).kind());
        assertTrue(errors.get(0).message().contains(String.class.getName()));
        assertTrue(errors.get(0).message().contains(UUID.class.getName()));
    }

    @Test
    public void testConjoinedDocumentsNeedConjoinedEvents() {
        StoreOptions storeOptions = StoreOptions.builder()
                .setEventTenancyStyle(TenancyStyle.SINGLE)
                .addDocumentMapping(CustomerSummary.class, String.class, TenancyStyle.CONJOINED)
                .build();

        List<ProjectionConfigurationError> errors = validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.IDENTITY_RULES, storeOptions);

        assertEquals(List.of(TENANCY_MISMATCH), errors.stream().map(ProjectionConfigurationError::kind).toList());
    }

    @Test
    public void testCustomSlicersSkipTheTenancyCheck() {
        StoreOptions storeOptions = StoreOptions.builder()
                .setEventTenancyStyle(TenancyStyle.SINGLE)
                .addDocumentMapping(CustomerSummary.class, String.class, TenancyStyle.CONJOINED)
                .build();

        assertTrue(validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.CUSTOM_SLICER,
                storeOptions).isEmpty());
    }

    @Test
    public void testSingleTenantDocumentsAcceptConjoinedEvents() {
        StoreOptions storeOptions = StoreOptions.builder()
                .setEventTenancyStyle(TenancyStyle.CONJOINED)
                .addDocumentMapping(CustomerSummary.class, String.class, TenancyStyle.SINGLE)
                .build();

        assertTrue(validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.IDENTITY_RULES, storeOptions).isEmpty());
    }

    @Test
    public void testAllErrorsAreReported() {
        StoreOptions storeOptions = StoreOptions.builder()
                .addDocumentMapping(CustomerSummary.class, Long.class, TenancyStyle.CONJOINED)
                .build();

        List<ProjectionConfigurationError> errors = validator.validate("customers", CustomerSummary.class, String.class, null, storeOptions);

        assertEquals(List.of(MISSING_GROUPING_RULE, IDENTITY_TYPE_MISMATCH, TENANCY_MISMATCH),
                errors.stream().map(ProjectionConfigurationError::kind).toList());
    }

    @Test
    public void testMissingDocumentMapping() {
        List<ProjectionConfigurationError> errors = validator.validate("customers", CustomerSummary.class, String.class, GroupingStrategy.IDENTITY_RULES,
                StoreOptions.builder().build());

        assertEquals(List.of(MISSING_DOCUMENT_MAPPING), errors.stream().map(ProjectionConfigurationError::kind).toList());
    }
}
