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

import org.elasticsoftware.eventslicer.protocol.DomainEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs a {@link ProjectionPartition} for every partition of the event topic.
 */
public class ProjectionController implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionController.class);
    private final ConsumerFactory<String, DomainEventRecord> consumerFactory;
    private final ProjectionRuntime runtime;
    private final ProjectionSettings settings;
    private final List<ProjectionPartition> partitions = new ArrayList<>();
    private ExecutorService executorService;

    public ProjectionController(ConsumerFactory<String, DomainEventRecord> consumerFactory,
                                ProjectionRuntime runtime,
                                ProjectionSettings settings) {
        this.consumerFactory = consumerFactory;
        this.runtime = runtime;
        this.settings = settings;
    }

    public void start() {
        if (!settings.autoStart()) {
            logger.info("Not starting {}Projection, automatic start is disabled", runtime.getName());
            return;
        }
        executorService = Executors.newFixedThreadPool(settings.partitions(),
                runnable -> new Thread(runnable, runtime.getName() + "Projection-" + partitions.size()));
        for (int id = 0; id < settings.partitions(); id++) {
            ProjectionPartition partition = new ProjectionPartition(consumerFactory, runtime, settings.topic(), id);
            partitions.add(partition);
            executorService.submit(partition);
        }
        logger.info("Started {} partitions of {}Projection on topic {}", partitions.size(), runtime.getName(), settings.topic());
    }

    public boolean isRunning() {
        return !partitions.isEmpty() && partitions.stream().allMatch(ProjectionPartition::isProcessing);
    }

    @Override
    public void close() {
        partitions.forEach(ProjectionPartition::close);
        partitions.clear();
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }
}
