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

package org.elasticsoftware.eventslicer.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.elasticsoftware.eventslicer.annotations.DomainEventInfo;

public record DomainEventType<T extends DomainEvent>(String typeName, int version, @JsonIgnore Class<T> typeClass) {

    /**
     * Resolves the type from the {@link DomainEventInfo} annotation on the class. Classes without the
     * annotation are named after their simple class name, with version 1.
     */
    public static <T extends DomainEvent> DomainEventType<T> of(Class<T> typeClass) {
        DomainEventInfo eventInfo = typeClass.getAnnotation(DomainEventInfo.class);
        if (eventInfo != null) {
            return new DomainEventType<>(eventInfo.type(), eventInfo.version(), typeClass);
        }
        return new DomainEventType<>(typeClass.getSimpleName(), 1, typeClass);
    }
}
