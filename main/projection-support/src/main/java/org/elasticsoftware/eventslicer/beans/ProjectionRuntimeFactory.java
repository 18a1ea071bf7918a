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

package org.elasticsoftware.eventslicer.beans;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.eventslicer.annotations.ProjectionInfo;
import org.elasticsoftware.eventslicer.kafka.KafkaProjectionRuntime;
import org.elasticsoftware.eventslicer.kafka.ProjectionRuntime;
import org.elasticsoftware.eventslicer.kafka.ProjectionStore;
import org.elasticsoftware.eventslicer.projections.CompiledProjection;
import org.elasticsoftware.eventslicer.projections.DefaultProjectionBuilder;
import org.elasticsoftware.eventslicer.projections.MultiStreamProjection;
import org.elasticsoftware.eventslicer.store.StoreOptions;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.FactoryBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;

import java.util.concurrent.Executor;

public class ProjectionRuntimeFactory implements FactoryBean<ProjectionRuntime>, ApplicationContextAware {
    private ApplicationContext applicationContext;
    private final ObjectMapper objectMapper;
    private final StoreOptions storeOptions;
    private final Executor grouperExecutor;
    private final MultiStreamProjection<?, ?> projection;
    private final String projectionBeanName;

    public ProjectionRuntimeFactory(ObjectMapper objectMapper,
                                    StoreOptions storeOptions,
                                    Executor grouperExecutor,
                                    MultiStreamProjection<?, ?> projection,
                                    String projectionBeanName) {
        this.objectMapper = objectMapper;
        this.storeOptions = storeOptions;
        this.grouperExecutor = grouperExecutor;
        this.projection = projection;
        this.projectionBeanName = projectionBeanName;
    }

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public ProjectionRuntime getObject() throws Exception {
        return createRuntime(projection);
    }

    @Override
    public Class<?> getObjectType() {
        return ProjectionRuntime.class;
    }

    private <D, I> ProjectionRuntime createRuntime(MultiStreamProjection<D, I> projection) {
        ProjectionInfo projectionInfo = projection.getClass().getAnnotation(ProjectionInfo.class);

        if (projectionInfo == null) {
            throw new IllegalStateException("Class implementing MultiStreamProjection must be annotated with @ProjectionInfo");
        }
        // throws InvalidProjectionException with all configuration errors, which fails the context
        CompiledProjection<D, I> compiledProjection = DefaultProjectionBuilder.forProjection(projection, grouperExecutor)
                .build(storeOptions);

        return new KafkaProjectionRuntime.Builder<I>()
                .setObjectMapper(objectMapper)
                .setProjectionInfo(projectionInfo)
                .setProjection(compiledProjection)
                .setProjectionStore(resolveProjectionStore())
                .build();
    }

    /**
     * Uses the bean named {@code <projectionBean>Store} when present, otherwise the only
     * {@link ProjectionStore} in the context.
     */
    @SuppressWarnings("unchecked")
    private <I> ProjectionStore<I> resolveProjectionStore() {
        String storeBeanName = projectionBeanName + "Store";
        if (applicationContext.containsBean(storeBeanName)) {
            return applicationContext.getBean(storeBeanName, ProjectionStore.class);
        }
        ProjectionStore<?> store = applicationContext.getBeanProvider(ProjectionStore.class).getIfUnique();
        if (store == null) {
            throw new IllegalStateException("No unique ProjectionStore found for projection " + projectionBeanName +
                    ", register a single ProjectionStore bean or one named " + storeBeanName);
        }
        return (ProjectionStore<I>) store;
    }
}
