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

import org.elasticsoftware.ledger.account.AccountState;
import org.elasticsoftware.ledger.account.commands.AccountCommand;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.state.AccountRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/**
 * {@link CommandRouter} that shards clients over a number of {@link AccountPartition}s, each running on
 * its own thread. A client always maps to the same partition so its commands keep their order.
 */
public class PartitionedIngestionRouter implements CommandRouter {
    private static final Logger logger = LoggerFactory.getLogger(PartitionedIngestionRouter.class);
    private final List<AccountPartition> partitions;
    private final ExecutorService executorService;

    public PartitionedIngestionRouter(int partitionCount,
                                      int queueCapacity,
                                      AccountRepositoryFactory accountRepositoryFactory) {
        this(partitionCount, queueCapacity, accountRepositoryFactory, IngestionRouter.LOG_REJECTIONS);
    }

    public PartitionedIngestionRouter(int partitionCount,
                                      int queueCapacity,
                                      AccountRepositoryFactory accountRepositoryFactory,
                                      Consumer<ErrorEvent> errorEventConsumer) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive, got " + partitionCount);
        }
        this.partitions = IntStream.range(0, partitionCount)
                .mapToObj(id -> new AccountPartition(id, accountRepositoryFactory.create(id), errorEventConsumer, queueCapacity))
                .toList();
        this.executorService = Executors.newFixedThreadPool(partitionCount, new CustomizableThreadFactory("AccountPartitionThread-"));
        partitions.forEach(executorService::submit);
        logger.info("Started {} AccountPartitions", partitionCount);
    }

    public int getPartitionCount() {
        return partitions.size();
    }

    @Override
    public void route(AccountCommand command) {
        partitions.get(PartitionUtils.resolvePartition(command.client(), partitions.size())).route(command);
    }

    @Override
    public Map<Integer, AccountState> snapshot() {
        Map<Integer, AccountState> snapshot = new HashMap<>();
        partitions.forEach(partition -> snapshot.putAll(partition.query(IngestionRouter::snapshot)));
        return snapshot;
    }

    @Override
    public IngestionReport report() {
        return IngestionReport.merge(partitions.stream().map(partition -> partition.query(IngestionRouter::report)).toList());
    }

    @Override
    public void close() {
        IllegalStateException failure = null;
        try {
            for (AccountPartition partition : partitions) {
                try {
                    partition.close();
                } catch (IllegalStateException e) {
                    if (failure == null) {
                        failure = e;
                    }
                }
            }
            executorService.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
            throw new IllegalStateException("Interrupted while shutting down AccountPartitions", e);
        }
        if (failure != null) {
            throw failure;
        }
    }
}
