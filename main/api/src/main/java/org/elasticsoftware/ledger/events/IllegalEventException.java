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

package org.elasticsoftware.ledger.events;

import org.elasticsoftware.ledger.LedgerException;

/**
 * Thrown when an aggregate is asked to apply an event it cannot apply, for instance an {@link ErrorEvent}.
 */
public class IllegalEventException extends LedgerException {
    private final transient DomainEvent event;

    public IllegalEventException(String aggregateName, String aggregateId, DomainEvent event) {
        super("Cannot apply " + event.getClass().getSimpleName() + " to " + aggregateName + " with id " + aggregateId,
                aggregateName,
                aggregateId);
        this.event = event;
    }

    public DomainEvent getEvent() {
        return event;
    }
}
