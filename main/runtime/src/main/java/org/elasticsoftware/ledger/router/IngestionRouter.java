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

package org.elasticsoftware.ledger.router;

import org.elasticsoftware.ledger.account.Account;
import org.elasticsoftware.ledger.account.AccountState;
import org.elasticsoftware.ledger.account.commands.AccountCommand;
import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.DomainEventType;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.state.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Single threaded {@link CommandRouter}. Every command is handled by the account of its client and
 * the resulting events are applied right away. Rejected commands are dropped and their
 * {@link ErrorEvent} is passed to the error consumer.
 */
public class IngestionRouter implements CommandRouter {
    private static final Logger logger = LoggerFactory.getLogger(IngestionRouter.class);
    public static final Consumer<ErrorEvent> LOG_REJECTIONS = IngestionRouter::logRejection;
    private final AccountRepository accountRepository;
    private final Consumer<ErrorEvent> errorEventConsumer;
    private long accepted = 0L;
    private long rejected = 0L;
    private final Map<String, Long> rejections = new TreeMap<>();

    public IngestionRouter(AccountRepository accountRepository) {
        this(accountRepository, LOG_REJECTIONS);
    }

    public IngestionRouter(AccountRepository accountRepository, Consumer<ErrorEvent> errorEventConsumer) {
        this.accountRepository = accountRepository;
        this.errorEventConsumer = errorEventConsumer;
    }

    @Override
    public void route(AccountCommand command) {
        Account account = accountRepository.getOrCreate(command.client());
        List<DomainEvent> events = account.handle(command);
        if (Aggregate.isRejection(events)) {
            rejected++;
            for (DomainEvent event : events) {
                if (event instanceof ErrorEvent errorEvent) {
                    rejections.merge(DomainEventType.of(errorEvent.getClass()).typeName(), 1L, Long::sum);
                    errorEventConsumer.accept(errorEvent);
                }
            }
        } else {
            account.apply(events);
            accepted++;
            logger.debug("Applied {} to Account {} at version {}", events, account.getAggregateId(), account.getVersion());
        }
    }

    @Override
    public Map<Integer, AccountState> snapshot() {
        Map<Integer, AccountState> snapshot = new HashMap<>();
        accountRepository.values().forEach(account -> snapshot.put(account.getClient(), account.getState()));
        return snapshot;
    }

    @Override
    public IngestionReport report() {
        return new IngestionReport(accepted, rejected, rejections);
    }

    private static void logRejection(ErrorEvent errorEvent) {
        logger.warn("Rejected command for Account {}: {}", errorEvent.getAggregateId(), errorEvent);
    }
}
