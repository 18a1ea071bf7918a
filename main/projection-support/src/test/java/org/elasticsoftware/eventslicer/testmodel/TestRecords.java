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

package org.elasticsoftware.eventslicer.testmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.elasticsoftware.eventslicer.events.DomainEvent;
import org.elasticsoftware.eventslicer.events.DomainEventType;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.elasticsoftware.eventslicer.protocol.PayloadEncoding;

import java.util.Optional;

public final class TestRecords {
    public static final String TOPIC = "DomainEvents";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private TestRecords() {
    }

    public static DomainEventRecord eventRecord(String tenantId, String streamId, long sequence, long timestamp, DomainEvent event)
            throws JsonProcessingException {
        DomainEventType<?> type = DomainEventType.of(event.getClass());
        return new DomainEventRecord(tenantId, streamId, type.typeName(), type.version(),
                objectMapper.writeValueAsBytes(event), PayloadEncoding.JSON, sequence, timestamp);
    }

    public static ConsumerRecord<String, DomainEventRecord> consumerRecord(int partition, long offset, DomainEventRecord eventRecord) {
        return new ConsumerRecord<>(TOPIC, partition, offset, eventRecord.timestamp(), TimestampType.CREATE_TIME,
                ConsumerRecord.NULL_SIZE, ConsumerRecord.NULL_SIZE, eventRecord.streamId(), eventRecord,
                new RecordHeaders(), Optional.empty());
    }
}
