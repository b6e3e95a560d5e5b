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

package org.elasticsoftware.ledger.generator;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.elasticsoftware.ledger.protocol.TransactionRecord;
import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;
import org.elasticsoftware.ledger.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Writes a synthetic stream of transactions. Every client first receives a deposit, the rest of the
 * budget is spread over deposits, withdrawals, disputes, resolves and chargebacks on random clients.
 * Transaction ids are sequential starting at 1.
 */
public class TransactionGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TransactionGenerator.class);
    static final int MAX_CLIENTS = 0xFFFF;
    static final long MAX_TRANSACTIONS = 0xFFFFFFFFL;
    static final int CHUNK_SIZE = 50;
    // unscaled amounts, 4 fractional digits
    static final long MIN_DEPOSIT = 300_000L;
    static final long MAX_DEPOSIT = 5_000_000L;
    static final long MIN_WITHDRAWAL = 100_000L;
    static final long MAX_WITHDRAWAL = 4_000_000L;
    private final CsvMapper mapper;
    private final Random random;
    private final int clients;
    private final long transactions;

    public TransactionGenerator(CsvMapper mapper, Random random, int clients, long transactions) {
        if (clients < 2 || clients > MAX_CLIENTS) {
            throw new IllegalArgumentException("clients must be in [2, " + MAX_CLIENTS + "], got " + clients);
        }
        if (transactions < 0 || transactions > MAX_TRANSACTIONS) {
            throw new IllegalArgumentException("transactions must be in [0, " + MAX_TRANSACTIONS + "], got " + transactions);
        }
        this.mapper = mapper;
        this.random = random;
        this.clients = clients;
        this.transactions = transactions;
    }

    /**
     * @return the number of transactions written
     */
    public long generate(OutputStream output) throws IOException {
        logger.info("Generating {} transactions for {} clients", transactions, clients);
        try (SequenceWriter writer = mapper.writer(LedgerCsvMapper.transactionWriteSchema(mapper))
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(output)) {
            Batch batch = new Batch(writer);
            writeInitialDeposits(batch);
            writeMixedTransactions(batch);
            logger.debug("Generating {} more deposits", transactions - batch.written);
            while (batch.written < transactions) {
                batch.deposit(randomClient());
            }
            logger.info("Generated {} transactions for {} clients", batch.written, clients);
            return batch.written;
        } finally {
            output.flush();
        }
    }

    private void writeInitialDeposits(Batch batch) throws IOException {
        logger.debug("Generating {} initial deposits", clients - 1);
        List<Integer> clientIds = IntStream.range(1, clients).boxed().toList();
        for (int start = 0; start < clientIds.size() && batch.written < transactions; start += CHUNK_SIZE) {
            List<Integer> chunk = new ArrayList<>(clientIds.subList(start, Math.min(start + CHUNK_SIZE, clientIds.size())));
            Collections.shuffle(chunk, random);
            for (int client : chunk) {
                if (batch.written == transactions) {
                    return;
                }
                batch.deposit(client);
            }
        }
    }

    private void writeMixedTransactions(Batch batch) throws IOException {
        long remaining = transactions - batch.written;
        long deposits = (long) (remaining * 0.4);
        long withdrawals = (long) (remaining * 0.4);
        long disputes = (long) (remaining * 0.15);
        long resolves = (long) (remaining * 0.025);
        long chargebacks = (long) (remaining * 0.025);
        logger.debug("Generating {} deposits, {} withdrawals, {} disputes, {} resolves and {} chargebacks",
                deposits, withdrawals, disputes, resolves, chargebacks);

        while (deposits > 0 || withdrawals > 0 || disputes > 0) {
            int client = randomClient();
            if (deposits > 0) {
                batch.deposit(client);
                deposits--;
            }
            if (withdrawals > 0) {
                batch.write(new TransactionRecord("withdraw", client, batch.nextTx(),
                        randomAmount(MIN_WITHDRAWAL, MAX_WITHDRAWAL)));
                withdrawals--;
            }
            if (disputes > 0) {
                // the previous but one transaction, usually the deposit of this round
                long disputed = batch.written - 1;
                batch.write(new TransactionRecord("dispute", client, disputed, null));
                disputes--;
                if (resolves > 0) {
                    batch.write(new TransactionRecord("resolve", client, disputed, null));
                    resolves--;
                } else if (chargebacks > 0) {
                    batch.write(new TransactionRecord("chargeback", client, disputed, null));
                    chargebacks--;
                }
            }
        }
    }

    private int randomClient() {
        return 1 + random.nextInt(clients - 1);
    }

    private BigDecimal randomAmount(long min, long max) {
        return Amounts.of(min + (long) random.nextInt((int) (max - min)));
    }

    private final class Batch {
        private final SequenceWriter writer;
        private long written = 0L;

        private Batch(SequenceWriter writer) {
            this.writer = writer;
        }

        private long nextTx() {
            return written + 1;
        }

        private void deposit(int client) throws IOException {
            write(new TransactionRecord("deposit", client, nextTx(), randomAmount(MIN_DEPOSIT, MAX_DEPOSIT)));
        }

        private void write(TransactionRecord record) throws IOException {
            writer.write(record);
            written++;
        }
    }
}
