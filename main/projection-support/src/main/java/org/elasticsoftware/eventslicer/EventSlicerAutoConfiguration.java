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

package org.elasticsoftware.eventslicer;

import com.google.common.util.concurrent.MoreExecutors;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.elasticsoftware.eventslicer.beans.ProjectionBeanFactoryPostProcessor;
import org.elasticsoftware.eventslicer.kafka.ProjectionSettings;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.elasticsoftware.eventslicer.serialization.DomainEventRecordSerde;
import org.elasticsoftware.eventslicer.store.DocumentMapping;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.elasticsoftware.eventslicer.store.TenancyStyle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@AutoConfigureAfter(KafkaAutoConfiguration.class)
@PropertySource("classpath:eventslicer-projections.properties")
public class EventSlicerAutoConfiguration {
    private final DomainEventRecordSerde serde = new DomainEventRecordSerde();

    @Bean(name = "projectionBeanFactoryPostProcessor")
    public static ProjectionBeanFactoryPostProcessor projectionBeanFactoryPostProcessor() {
        return new ProjectionBeanFactoryPostProcessor();
    }

    /**
     * Collects the {@link DocumentMapping} beans of the application, unless it defines its own
     * {@link StoreOptions}.
     */
    @ConditionalOnMissingBean(StoreOptions.class)
    @Bean(name = "eventSlicerStoreOptions")
    public StoreOptions storeOptions(@Value("${eventslicer.events.tenancy-style:SINGLE}") TenancyStyle eventTenancyStyle,
                                     ObjectProvider<DocumentMapping> documentMappings) {
        StoreOptions.Builder builder = StoreOptions.builder().setEventTenancyStyle(eventTenancyStyle);
        documentMappings.orderedStream().forEach(mapping ->
                builder.addDocumentMapping(mapping.documentType(), mapping.idType(), mapping.tenancyStyle()));
        return builder.build();
    }

    @Bean(name = "eventSlicerGrouperExecutor", destroyMethod = "shutdown")
    public ExecutorService grouperExecutor(@Value("${eventslicer.groupers.parallelism:1}") int parallelism) {
        if (parallelism <= 1) {
            return MoreExecutors.newDirectExecutorService();
        }
        return Executors.newFixedThreadPool(parallelism);
    }

    @Bean(name = "eventSlicerProjectionSettings")
    public ProjectionSettings projectionSettings(@Value("${eventslicer.projections.topic:DomainEvents}") String topic,
                                                 @Value("${eventslicer.projections.partitions:1}") int partitions,
                                                 @Value("${eventslicer.projections.auto-start:true}") boolean autoStart) {
        return new ProjectionSettings(topic, partitions, autoStart);
    }

    @ConditionalOnBean(KafkaProperties.class)
    @ConditionalOnMissingBean(name = "eventSlicerConsumerFactory")
    @Bean(name = "eventSlicerConsumerFactory")
    public ConsumerFactory<String, DomainEventRecord> consumerFactory(KafkaProperties properties) {
        return new DefaultKafkaConsumerFactory<>(properties.buildConsumerProperties(null), new StringDeserializer(), serde.deserializer());
    }
}
