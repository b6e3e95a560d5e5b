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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.commands.Command;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.util.List;

/**
 * Consistency boundary that decides on commands and evolves its state from the events it produced.
 *
 * <p>{@link #handle(Command)} is a pure decision: it inspects the current state and returns either the
 * events to apply or a single {@link ErrorEvent}. Only {@link #apply(List)} changes the state, and only
 * with events previously returned by {@code handle}.
 *
 * @param <S> the externally visible state
 * @param <C> the commands this aggregate accepts
 * @param <E> the events this aggregate applies
 */
public interface Aggregate<S extends AggregateState, C extends Command, E extends DomainEvent> {
    default String getName() {
        AggregateInfo info = getClass().getAnnotation(AggregateInfo.class);
        return info != null ? info.value() : getClass().getSimpleName();
    }

    @NotNull String getAggregateId();

    @NotNull S getState();

    /**
     * @return the number of events applied so far
     */
    long getVersion();

    @NotNull List<DomainEvent> handle(@NotNull C command);

    void apply(@NotNull List<? extends DomainEvent> events);

    static boolean isRejection(List<? extends DomainEvent> events) {
        return events.stream().anyMatch(event -> event instanceof ErrorEvent);
    }
}
