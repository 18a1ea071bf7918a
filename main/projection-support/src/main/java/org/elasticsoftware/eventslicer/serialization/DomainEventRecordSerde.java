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

package org.elasticsoftware.eventslicer.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.protobuf.ProtobufMapper;
import com.fasterxml.jackson.dataformat.protobuf.schema.ProtobufSchema;
import com.fasterxml.jackson.dataformat.protobuf.schema.ProtobufSchemaLoader;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.Map;

public final class DomainEventRecordSerde implements Serde<DomainEventRecord> {
    private static final String domainEventRecordProto = """
        // org.elasticsoftware.eventslicer.protocol.DomainEventRecord

        // Message for org.elasticsoftware.eventslicer.protocol.DomainEventRecord
        message DomainEventRecord {
          optional string tenantId = 1;
          optional string streamId = 2;
          optional string name = 3;
          optional int32 version = 4;
          optional bytes payload = 5;
          optional PayloadEncoding encoding = 6;
          optional int64 sequence = 7;
          optional int64 timestamp = 8;
        }
        // Enum for org.elasticsoftware.eventslicer.protocol.PayloadEncoding
        enum PayloadEncoding {
          JSON = 0;
          PROTOBUF = 1;
        }
        """;
    private final ObjectMapper objectMapper = new ProtobufMapper();
    private final Serializer<DomainEventRecord> serializer;
    private final Deserializer<DomainEventRecord> deserializer;

    public DomainEventRecordSerde() {
        try {
            ProtobufSchema schema = ProtobufSchemaLoader.std.load(new StringReader(domainEventRecordProto));
            serializer = new SerializerImpl(objectMapper.writer(schema));
            deserializer = new DeserializerImpl(objectMapper.readerFor(DomainEventRecord.class).with(schema));
        } catch (IOException e) {
            throw new SerializationException(e);
        }
    }

    @Override
    public void configure(Map<String, ?> configs, boolean isKey) {

    }

    @Override
    public void close() {

    }

    @Override
    public Serializer<DomainEventRecord> serializer() {
        return serializer;
    }

    @Override
    public Deserializer<DomainEventRecord> deserializer() {
        return deserializer;
    }

    private static class SerializerImpl implements Serializer<DomainEventRecord> {
        private final ObjectWriter writer;

        private SerializerImpl(ObjectWriter writer) {
            this.writer = writer;
        }

        @Override
        public byte[] serialize(String topic, DomainEventRecord data) {
            if (data == null) {
                return null;
            }
            try {
                return writer.writeValueAsBytes(data);
            } catch (JsonProcessingException e) {
                throw new SerializationException(e);
            }
        }
    }

    private static class DeserializerImpl implements Deserializer<DomainEventRecord> {
        private final ObjectReader reader;

        private DeserializerImpl(ObjectReader reader) {
            this.reader = reader;
        }

        @Override
        public DomainEventRecord deserialize(String topic, byte[] data) {
            if (data == null) {
                return null;
            }
            try {
                return reader.readValue(data);
            } catch (IOException e) {
                throw new SerializationException("Unable to read DomainEventRecord from topic " + topic, e);
            }
        }
    }
}
