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
import org.elasticsoftware.eventslicer.kafka.ProjectionController;
import org.elasticsoftware.eventslicer.projections.MultiStreamProjection;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.support.BeanDefinitionBuilder;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.ApplicationContextException;
import org.springframework.util.ClassUtils;

import java.util.Arrays;

/**
 * Registers a {@link ProjectionRuntimeFactory} and a {@link ProjectionController} for every bean annotated
 * with {@link ProjectionInfo}.
 */
public class ProjectionBeanFactoryPostProcessor implements BeanFactoryPostProcessor {
    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) throws BeansException {
        if (beanFactory instanceof BeanDefinitionRegistry bdr) {
            Arrays.asList(beanFactory.getBeanNamesForAnnotation(ProjectionInfo.class)).forEach(beanName -> {
                BeanDefinition bd = beanFactory.getBeanDefinition(beanName);
                try {
                    Class<?> projectionClass = ClassUtils.forName(bd.getBeanClassName(), beanFactory.getBeanClassLoader());
                    if (!MultiStreamProjection.class.isAssignableFrom(projectionClass)) {
                        throw new ApplicationContextException("Bean " + beanName + " is annotated with @ProjectionInfo but " +
                                projectionClass.getName() + " does not implement MultiStreamProjection");
                    }
                } catch (ClassNotFoundException e) {
                    throw new ApplicationContextException("Unable to load class for bean " + beanName, e);
                }
                bdr.registerBeanDefinition(beanName + "ProjectionRuntime",
                        BeanDefinitionBuilder.genericBeanDefinition(ProjectionRuntimeFactory.class)
                                .addConstructorArgReference(beanFactory.getBeanNamesForType(ObjectMapper.class)[0])
                                .addConstructorArgReference("eventSlicerStoreOptions")
                                .addConstructorArgReference("eventSlicerGrouperExecutor")
                                .addConstructorArgReference(beanName)
                                .addConstructorArgValue(beanName)
                                .getBeanDefinition());
                bdr.registerBeanDefinition(beanName + "ProjectionController",
                        BeanDefinitionBuilder.genericBeanDefinition(ProjectionController.class)
                                .addConstructorArgReference("eventSlicerConsumerFactory")
                                .addConstructorArgReference(beanName + "ProjectionRuntime")
                                .addConstructorArgReference("eventSlicerProjectionSettings")
                                .setInitMethodName("start")
                                .setDestroyMethodName("close")
                                .getBeanDefinition());
            });
        } else {
            throw new ApplicationContextException("BeanFactory is not a BeanDefinitionRegistry");
        }
    }
}
