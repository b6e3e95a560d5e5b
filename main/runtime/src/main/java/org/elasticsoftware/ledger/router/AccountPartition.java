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

import org.elasticsoftware.ledger.account.commands.AccountCommand;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.state.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.elasticsoftware.ledger.router.AccountPartitionState.PROCESSING;
import static org.elasticsoftware.ledger.router.AccountPartitionState.SHUTTING_DOWN;

/**
 * Owns the accounts of one partition and handles their commands on a single thread, in the order in
 * which they were submitted.
 */
public class AccountPartition implements Runnable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AccountPartition.class);
    private static final long POLL_TIMEOUT_MS = 100L;
    private final int id;
    private final IngestionRouter router;
    private final BlockingQueue<Consumer<IngestionRouter>> tasks;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    // guards the shutdown transition against tasks that are being enqueued
    private final Object submitLock = new Object();
    private volatile AccountPartitionState processState = PROCESSING;
    private volatile Throwable failure = null;

    public AccountPartition(int id,
                            AccountRepository accountRepository,
                            Consumer<ErrorEvent> errorEventConsumer,
                            int queueCapacity) {
        this.id = id;
        this.router = new IngestionRouter(accountRepository, errorEventConsumer);
        this.tasks = new LinkedBlockingQueue<>(queueCapacity);
    }

    public int getId() {
        return id;
    }

    @Override
    public void run() {
        try {
            logger.info("Starting AccountPartition {}", id);
            // drain whatever was submitted before shutdown was requested
            while (processState != SHUTTING_DOWN || !tasks.isEmpty()) {
                Consumer<IngestionRouter> task = tasks.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    task.accept(router);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
            logger.warn("AccountPartition {} was interrupted", id);
        } catch (Throwable t) {
            failure = t;
            logger.error("Unexpected error in AccountPartition {}", id, t);
        } finally {
            processState = SHUTTING_DOWN;
            logger.info("Finished shutting down AccountPartition {}", id);
            shutdownLatch.countDown();
        }
    }

    public void route(AccountCommand command) {
        submit(router -> router.route(command));
    }

    /**
     * Runs the query on the partition thread after all previously routed commands were handled.
     */
    public <T> T query(Function<IngestionRouter, T> query) {
        CompletableFuture<T> result = new CompletableFuture<>();
        submit(router -> {
            try {
                result.complete(query.apply(router));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        try {
            while (true) {
                try {
                    return result.get(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    checkFailure();
                }
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("Query failed on AccountPartition " + id, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while querying AccountPartition " + id, e);
        }
    }

    /**
     * Enqueues the task unless shutdown was requested. A task that was enqueued is always run, the worker
     * only stops once it observed the shutdown with an empty queue.
     */
    private void submit(Consumer<IngestionRouter> task) {
        synchronized (submitLock) {
            if (processState == SHUTTING_DOWN) {
                throw new IllegalStateException("AccountPartition " + id + " is shutting down");
            }
            try {
                while (!tasks.offer(task, POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    checkFailure();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while routing to AccountPartition " + id, e);
            }
        }
    }

    private void checkFailure() {
        if (failure != null) {
            throw new IllegalStateException("AccountPartition " + id + " failed", failure);
        }
    }

    @Override
    public void close() throws InterruptedException {
        synchronized (submitLock) {
            processState = SHUTTING_DOWN;
        }
        shutdownLatch.await();
        checkFailure();
    }
}
