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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.elasticsoftware.eventslicer.annotations.ProjectionInfo;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.DefaultProjectionBuilder;
import org.elasticsoftware.eventslicer.projections.ProjectionBuilder;
import org.elasticsoftware.eventslicer.projections.QuerySession;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.elasticsoftware.eventslicer.protocol.PayloadEncoding;
import org.elasticsoftware.eventslicer.slicing.EventSlice;
import org.elasticsoftware.eventslicer.slicing.TenantSliceGroup;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.elasticsoftware.eventslicer.testmodel.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.elasticsoftware.eventslicer.testmodel.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class KafkaProjectionRuntimeTests {
    private final TopicPartition partition0 = new TopicPartition(TOPIC, 0);
    private final TopicPartition partition1 = new TopicPartition(TOPIC, 1);
    private ProjectionStore<String> store;
    private QuerySession session;
    private KafkaProjectionRuntime<String> runtime;

    @SuppressWarnings("unchecked")
    @BeforeEach
    public void setUp() {
        store = mock(ProjectionStore.class);
        session = mock(QuerySession.class);
        when(store.openSession()).thenReturn(session);
        StoreOptions storeOptions = StoreOptions.builder()
                .addDocumentMapping(WalletSummary.class, String.class)
                .build();
        WalletSummaryProjection projection = new WalletSummaryProjection();
        runtime = new KafkaProjectionRuntime.Builder<String>()
                .setObjectMapper(new ObjectMapper())
                .setProjectionInfo(WalletSummaryProjection.class.getAnnotation(ProjectionInfo.class))
                .setProjection(DefaultProjectionBuilder.forProjection(projection, Runnable::run).build(storeOptions))
                .setProjectionStore(store)
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<TenantSliceGroup<String>> captureGroups(Map<String, Long> expectedOffsets) throws IOException {
        ArgumentCaptor<List<TenantSliceGroup<String>>> groups = ArgumentCaptor.forClass(List.class);
        verify(store).apply(eq("WalletSummaries"), groups.capture(), eq(expectedOffsets));
        return groups.getValue();
    }

    @Test
    public void testNameAndEventTypes() {
        assertEquals("WalletSummaries-v2", runtime.getName());
        assertEquals(Set.of("WalletCredited", "WalletDebited"), Set.copyOf(runtime.getDomainEventTypes().stream()
                .map(type -> type.typeName())
                .toList()));
        assertEquals(3, runtime.getDomainEventTypes().size());
    }

    @Test
    public void testRecordsAreSlicedInTimestampOrderAcrossPartitions() throws IOException {
        DomainEventRecord credited = eventRecord("tenant-1", "wallet-1", 1, 2000L, new WalletCredited("wallet-1", BigDecimal.TEN));
        DomainEventRecord debited = eventRecord("tenant-1", "wallet-1", 2, 1500L, new WalletDebited("wallet-1", BigDecimal.ONE));
        DomainEventRecord otherWallet = eventRecord("tenant-1", "wallet-2", 1, 1800L, new WalletCredited("wallet-2", BigDecimal.ONE));

        runtime.apply(Map.of(
                partition0, List.of(consumerRecord(0, 10, credited), consumerRecord(0, 11, otherWallet)),
                partition1, List.of(consumerRecord(1, 5, debited))));

        List<TenantSliceGroup<String>> groups = captureGroups(Map.of(partition0.toString(), 11L, partition1.toString(), 5L));
        assertEquals(1, groups.size());
        assertEquals("tenant-1", groups.get(0).tenantId());
        List<EventSlice<String>> slices = groups.get(0).slices();
        assertEquals(List.of("wallet-1", "wallet-2"), slices.stream().map(EventSlice::identity).toList());
        assertEquals(List.of(new WalletDebited("wallet-1", BigDecimal.ONE), new WalletCredited("wallet-1", BigDecimal.TEN)),
                slices.get(0).events().stream().map(StreamEvent::payload).toList());
        StreamEvent<?> first = slices.get(0).events().get(0);
        assertEquals("wallet-1", first.streamId());
        assertEquals(2L, first.sequence());
        assertEquals(1500L, first.timestamp().toEpochMilli());
        verify(store).openSession();
        verify(session).close();
    }

    @Test
    public void testSessionIsClosedWhenSlicingFails() throws IOException {
        WalletSummaryProjection failingProjection = new WalletSummaryProjection() {
            @Override
            public void configure(ProjectionBuilder<WalletSummary, String> builder) {
                super.configure(builder);
                builder.withCustomGrouping((querySession, events) -> {
                    throw new IOException("Wallet lookup failed");
                });
            }
        };
        KafkaProjectionRuntime<String> failingRuntime = new KafkaProjectionRuntime.Builder<String>()
                .setObjectMapper(new ObjectMapper())
                .setProjectionInfo(WalletSummaryProjection.class.getAnnotation(ProjectionInfo.class))
                .setProjection(DefaultProjectionBuilder.forProjection(failingProjection, Runnable::run)
                        .build(StoreOptions.builder().addDocumentMapping(WalletSummary.class, String.class).build()))
                .setProjectionStore(store)
                .build();
        DomainEventRecord credited = eventRecord("tenant-1", "wallet-1", 1, 1000L, new WalletCredited("wallet-1", BigDecimal.TEN));

        IOException exception = assertThrows(IOException.class,
                () -> failingRuntime.apply(Map.of(partition0, List.of(consumerRecord(0, 0, credited)))));

        assertEquals("Wallet lookup failed", exception.getMessage());
        verify(session).close();
        verify(store, never()).apply(anyString(), anyList(), anyMap());
    }

    @Test
    public void testUnknownEventsAreSkippedButTheirOffsetsAreApplied() throws IOException {
        DomainEventRecord renamed = new DomainEventRecord("tenant-1", "wallet-1", "WalletRenamed", 1,
                "{}".getBytes(), PayloadEncoding.JSON, 3, 1000L);

        runtime.apply(Map.of(partition0, List.of(consumerRecord(0, 7, renamed))));

        assertTrue(captureGroups(Map.of(partition0.toString(), 7L)).isEmpty());
        verify(store, never()).openSession();
    }

    @Test
    public void testHighestKnownVersionIsUsedForNewerRecords() throws IOException {
        DomainEventRecord v2 = eventRecord("tenant-1", "wallet-1", 1, 1000L, new WalletCreditedV2("wallet-1", BigDecimal.TEN, "EUR"));
        DomainEventRecord v3 = new DomainEventRecord(v2.tenantId(), v2.streamId(), v2.name(), 3, v2.payload(),
                v2.encoding(), 2, 1001L);
        DomainEventRecord v1 = eventRecord("tenant-1", "wallet-1", 3, 1002L, new WalletCredited("wallet-1", BigDecimal.ONE));

        runtime.apply(Map.of(partition0, List.of(consumerRecord(0, 0, v2), consumerRecord(0, 1, v3), consumerRecord(0, 2, v1))));

        List<Object> payloads = captureGroups(Map.of(partition0.toString(), 2L)).get(0).slices().get(0).events().stream()
                .<Object>map(StreamEvent::payload)
                .toList();
        assertEquals(List.of(
                new WalletCreditedV2("wallet-1", BigDecimal.TEN, "EUR"),
                new WalletCreditedV2("wallet-1", BigDecimal.TEN, "EUR"),
                new WalletCredited("wallet-1", BigDecimal.ONE)), payloads);
    }

    @Test
    public void testProtobufPayloadsAreNotSupported() {
        DomainEventRecord credited = new DomainEventRecord("tenant-1", "wallet-1", "WalletCredited", 1,
                new byte[0], PayloadEncoding.PROTOBUF, 1, 1000L);

        assertThrows(IOException.class, () -> runtime.apply(Map.of(partition0, List.of(consumerRecord(0, 0, credited)))));
        verifyNoInteractions(session);
    }

    @Test
    public void testOffsetsDefaultToNothingApplied() {
        when(store.getOffsets(Set.of(partition0.toString(), partition1.toString())))
                .thenReturn(Map.of(partition0.toString(), 42L));

        Map<TopicPartition, Long> offsets = runtime.initializeOffsets(List.of(partition0, partition1));

        assertEquals(Map.of(partition0, 42L, partition1, -1L), offsets);
    }
}
