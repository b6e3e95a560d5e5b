/*
 * Copyright 2022 - 2025 The Original Authors
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

package org.elasticsoftware.ledger.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.elasticsoftware.ledger.annotations.DomainEventInfo;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

public record DomainEventType<T extends DomainEvent>(
        String typeName,
        int version,
        @JsonIgnore Class<T> typeClass,
        boolean error
) {
    public static <T extends DomainEvent> DomainEventType<T> of(Class<T> eventClass) {
        DomainEventInfo info = eventClass.getAnnotation(DomainEventInfo.class);
        if (info == null) {
            throw new IllegalArgumentException("DomainEvent class " + eventClass.getName() + " must be annotated with @DomainEventInfo");
        }
        return new DomainEventType<>(info.type(), info.version(), eventClass, ErrorEvent.class.isAssignableFrom(eventClass));
    }
}
