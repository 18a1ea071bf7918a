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

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.elasticsoftware.eventslicer.kafka.ProjectionPartitionState.*;

/**
 * Consumes one partition of the event log for a single projection. Offsets are owned by the
 * {@link ProjectionStore}, so the consumer is assigned instead of subscribed and never commits.
 */
public class ProjectionPartition implements Runnable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionPartition.class);
    private final ConsumerFactory<String, DomainEventRecord> consumerFactory;
    private final ProjectionRuntime runtime;
    private final Integer id;
    private final TopicPartition eventPartition;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private Consumer<String, DomainEventRecord> consumer;
    private volatile ProjectionPartitionState processState;

    public ProjectionPartition(ConsumerFactory<String, DomainEventRecord> consumerFactory,
                               ProjectionRuntime runtime,
                               String topic,
                               Integer id) {
        this.consumerFactory = consumerFactory;
        this.runtime = runtime;
        this.id = id;
        this.eventPartition = new TopicPartition(topic, id);
        this.processState = INITIALIZING;
    }

    public Integer getId() {
        return id;
    }

    @Override
    public void run() {
        try {
            logger.info("Starting ProjectionPartition {} of {}Projection", id, runtime.getName());
            this.consumer = consumerFactory.createConsumer(
                    runtime.getName() + "Projection-partition-" + id,
                    runtime.getName() + "Projection-partition-" + id,
                    null);
            consumer.assign(List.of(eventPartition));
            logger.info("Assigned partitions {} for ProjectionPartition {} of {}Projection", consumer.assignment(), id, runtime.getName());
            while (processState != SHUTTING_DOWN) {
                process();
            }
            logger.info("Shutting down ProjectionPartition {} of {}Projection", id, runtime.getName());
        } catch (Throwable t) {
            logger.error("Unexpected error in ProjectionPartition {} of {}Projection", id, runtime.getName(), t);
        } finally {
            processState = SHUTTING_DOWN;
            if (consumer != null) {
                try {
                    consumer.close(Duration.ofSeconds(5));
                } catch (InterruptException e) {
                    // ignore
                } catch (KafkaException e) {
                    logger.error("Error closing consumer", e);
                }
            }
        }
        logger.info("Finished Shutting down ProjectionPartition {} of {}Projection", id, runtime.getName());
        shutdownLatch.countDown();
    }

    @Override
    public void close() {
        processState = SHUTTING_DOWN;
        // wait maximum of 10 seconds for the shutdown to complete
        try {
            if (shutdownLatch.await(10, TimeUnit.SECONDS)) {
                logger.info("ProjectionPartition={} has been shutdown", id);
            } else {
                logger.warn("ProjectionPartition={} did not shutdown within 10 seconds", id);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void process() {
        try {
            if (processState == PROCESSING) {
                ConsumerRecords<String, DomainEventRecord> allRecords = consumer.poll(Duration.ofMillis(10));
                if (!allRecords.isEmpty()) {
                    processRecords(allRecords);
                }
            } else if (processState == INITIALIZING) {
                logger.info("Initializing ProjectionPartition {} of {}Projection", id, runtime.getName());
                runtime.initializeOffsets(List.of(eventPartition)).forEach((topicPartition, offset)
                        -> consumer.seek(topicPartition, offset + 1));
                processState = PROCESSING;
            }
        } catch (WakeupException | InterruptException ignore) {
            // non-fatal. ignore
        } catch (KafkaException e) {
            // fatal
            logger.error("Fatal error during " + processState + " phase, shutting down ProjectionPartition " + id + " of " + runtime.getName() + "Projection", e);
            processState = SHUTTING_DOWN;
        }
    }

    private void processRecords(ConsumerRecords<String, DomainEventRecord> allRecords) {
        if (logger.isTraceEnabled()) {
            logger.trace("Processing {} records in a single batch", allRecords.count());
        }
        try {
            runtime.apply(allRecords.partitions().stream()
                    .collect(Collectors.toMap(
                            partition -> partition,
                            allRecords::records
                    )));
        } catch (IOException | RuntimeException e) {
            // the store did not record the offsets of this batch, a restart resumes from the last applied batch
            logger.error("Error while applying events, shutting down ProjectionPartition " + id + " of " + runtime.getName() + "Projection", e);
            processState = SHUTTING_DOWN;
        }
    }

    public boolean isProcessing() {
        return processState == PROCESSING;
    }

    public boolean isShutDown() {
        return shutdownLatch.getCount() == 0;
    }
}
