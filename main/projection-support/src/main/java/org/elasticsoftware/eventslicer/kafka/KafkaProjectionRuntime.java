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
import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.DomainEventType;
import org.elasticsoftware.eventslicer.events.StreamEvent;
import org.elasticsoftware.eventslicer.projections.CompiledProjection;
import org.elasticsoftware.eventslicer.projections.QuerySession;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.elasticsoftware.eventslicer.protocol.PayloadEncoding;
import org.elasticsoftware.eventslicer.slicing.TenantSliceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Feeds batches of durable events read from Kafka through the slicer of a compiled projection and
 * hands the resulting tenant groups to the {@link ProjectionStore}.
 * <p>
 * The records of a batch are ordered by timestamp, then by topic partition and offset. Records whose
 * type the projection does not handle are skipped, but still count towards the committed offsets.
 */
public class KafkaProjectionRuntime<I> implements ProjectionRuntime {
    private static final Logger logger = LoggerFactory.getLogger(KafkaProjectionRuntime.class);
    private static final Comparator<ConsumerRecord<String, DomainEventRecord>> BATCH_ORDER =
            Comparator.<ConsumerRecord<String, DomainEventRecord>>comparingLong(ConsumerRecord::timestamp)
                    .thenComparing(ConsumerRecord::topic)
                    .thenComparingInt(ConsumerRecord::partition)
                    .thenComparingLong(ConsumerRecord::offset);
    private final ObjectMapper objectMapper;
    private final CompiledProjection<?, I> projection;
    private final ProjectionStore<I> projectionStore;
    private final Map<String, List<DomainEventType<?>>> domainEventsByName;
    private final String name;
    private final int version;

    private KafkaProjectionRuntime(ObjectMapper objectMapper,
                                   CompiledProjection<?, I> projection,
                                   ProjectionStore<I> projectionStore,
                                   String name,
                                   int version) {
        this.objectMapper = objectMapper;
        this.projection = projection;
        this.projectionStore = projectionStore;
        this.domainEventsByName = projection.getDomainEventTypes().stream()
                .collect(Collectors.groupingBy(DomainEventType::typeName));
        this.name = name;
        this.version = version;
    }

    @Override
    public String getName() {
        return name + "-v" + version;
    }

    @Override
    public Collection<DomainEventType<?>> getDomainEventTypes() {
        return projection.getDomainEventTypes();
    }

    public CompiledProjection<?, I> getProjection() {
        return projection;
    }

    @Override
    public Map<TopicPartition, Long> initializeOffsets(Collection<TopicPartition> topicPartitions) {
        Set<String> partitionIds = topicPartitions.stream()
                .map(TopicPartition::toString)
                .collect(Collectors.toSet());

        Map<String, Long> offsets = projectionStore.getOffsets(partitionIds);

        return topicPartitions.stream()
                .collect(Collectors.toMap(
                        tp -> tp,
                        tp -> offsets.getOrDefault(tp.toString(), -1L)
                ));
    }

    @Override
    public void apply(Map<TopicPartition, List<ConsumerRecord<String, DomainEventRecord>>> records) throws IOException {
        List<ConsumerRecord<String, DomainEventRecord>> ordered = records.values().stream()
                .flatMap(List::stream)
                .sorted(BATCH_ORDER)
                .toList();
        List<StreamEvent<?>> events = new ArrayList<>(ordered.size());
        for (ConsumerRecord<String, DomainEventRecord> consumerRecord : ordered) {
            DomainEventRecord eventRecord = consumerRecord.value();
            if (eventRecord == null) {
                continue;
            }
            DomainEventType<?> domainEventType = getDomainEventType(eventRecord);
            // ignore events this projection does not handle
            if (domainEventType != null) {
                events.add(materialize(domainEventType, eventRecord));
            }
        }
        List<TenantSliceGroup<I>> groups = events.isEmpty() ? List.of() : slice(events);
        if (logger.isTraceEnabled()) {
            logger.trace("Projection {} sliced {} of {} records into {} tenant groups",
                    getName(), events.size(), ordered.size(), groups.size());
        }
        projectionStore.apply(projection.name(), groups, records.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .collect(Collectors.toMap(
                        entry -> entry.getKey().toString(),
                        entry -> entry.getValue().stream()
                                .mapToLong(ConsumerRecord::offset)
                                .max()
                                .orElse(-1L)
                )));
    }

    private List<TenantSliceGroup<I>> slice(List<StreamEvent<?>> events) throws IOException {
        try (QuerySession querySession = projectionStore.openSession()) {
            return projection.slicer().sliceAsyncEvents(querySession, events);
        }
    }

    private <E extends DomainEvent> StreamEvent<E> materialize(DomainEventType<E> domainEventType,
                                                              DomainEventRecord eventRecord) throws IOException {
        if (eventRecord.encoding() == PayloadEncoding.PROTOBUF) {
            throw new IOException("Unsupported payload encoding " + eventRecord.encoding() +
                    " for event " + eventRecord.name() + " v" + eventRecord.version());
        }
        E payload = objectMapper.readValue(eventRecord.payload(), domainEventType.typeClass());
        return new StreamEvent<>(
                eventRecord.streamId(),
                eventRecord.tenantId(),
                eventRecord.sequence(),
                0,
                domainEventType,
                payload,
                Instant.ofEpochMilli(eventRecord.timestamp()));
    }

    private DomainEventType<?> getDomainEventType(DomainEventRecord eventRecord) {
        // find the highest registered version that is not newer than the record version
        return domainEventsByName.getOrDefault(eventRecord.name(), List.of()).stream()
                .filter(type -> type.version() <= eventRecord.version())
                .max(Comparator.comparingInt(DomainEventType::version))
                .orElse(null);
    }

    public static class Builder<I> {
        private ObjectMapper objectMapper;
        private ProjectionInfo projectionInfo;
        private CompiledProjection<?, I> projection;
        private ProjectionStore<I> projectionStore;

        public Builder<I> setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<I> setProjectionInfo(ProjectionInfo projectionInfo) {
            this.projectionInfo = projectionInfo;
            return this;
        }

        public Builder<I> setProjection(CompiledProjection<?, I> projection) {
            this.projection = projection;
            return this;
        }

        public Builder<I> setProjectionStore(ProjectionStore<I> projectionStore) {
            this.projectionStore = projectionStore;
            return this;
        }

        public KafkaProjectionRuntime<I> build() {
            return new KafkaProjectionRuntime<>(
                    objectMapper,
                    projection,
                    projectionStore,
                    projectionInfo != null ? projectionInfo.value() : projection.name(),
                    projectionInfo != null ? projectionInfo.version() : 1);
        }
    }

    @Override
    public String toString() {
        return "KafkaProjectionRuntime{" + getName() + "}";
    }
}
