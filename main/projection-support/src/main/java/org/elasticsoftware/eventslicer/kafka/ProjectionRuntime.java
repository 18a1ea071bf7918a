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

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.elasticsoftware.eventslicer.events.DomainEventType;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface ProjectionRuntime {
    String getName();

    Collection<DomainEventType<?>> getDomainEventTypes();

    /**
     * Returns the last applied offset per partition, or -1 for partitions that have not been applied yet.
     */
    Map<TopicPartition, Long> initializeOffsets(Collection<TopicPartition> topicPartitions);

    void apply(Map<TopicPartition, List<ConsumerRecord<String, DomainEventRecord>>> records) throws IOException;
}
