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

import org.elasticsoftware.ledger.annotations.DomainEventInfo;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DomainEventTypeTests {

    @Test
    public void testDomainEventType() {
        DomainEventType<TestEvent> type = DomainEventType.of(TestEvent.class);

        assertEquals("Tested", type.typeName());
        assertEquals(1, type.version());
        assertEquals(TestEvent.class, type.typeClass());
        assertFalse(type.error());
    }

    @Test
    public void testErrorEventType() {
        DomainEventType<TestErrorEvent> type = DomainEventType.of(TestErrorEvent.class);

        assertEquals("TestFailed", type.typeName());
        assertTrue(type.error());
    }

    @Test
    public void testDomainEventTypeWithoutAnnotation() {
        assertThrows(IllegalArgumentException.class, () -> DomainEventType.of(UnannotatedEvent.class));
    }

    @DomainEventInfo(type = "Tested")
    record TestEvent(String id) implements DomainEvent {
        @Override
        public String getAggregateId() {
            return id;
        }
    }

    @DomainEventInfo(type = "TestFailed")
    record TestErrorEvent(String id) implements ErrorEvent {
        @Override
        public String getAggregateId() {
            return id;
        }
    }

    record UnannotatedEvent(String id) implements DomainEvent {
        @Override
        public String getAggregateId() {
            return id;
        }
    }
}
