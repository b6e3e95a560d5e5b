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

package org.elasticsoftware.ledger;

import org.elasticsoftware.ledger.csv.AccountSnapshotCsvWriter;
import org.elasticsoftware.ledger.csv.TransactionCsvReader;
import org.elasticsoftware.ledger.router.CommandRouter;
import org.elasticsoftware.ledger.router.CommandRouterFactory;
import org.elasticsoftware.ledger.router.IngestionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the transactions file given as first argument and prints the resulting account balances.
 */
public class IngestionRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(IngestionRunner.class);
    private final CommandRouterFactory commandRouterFactory;
    private final TransactionCsvReader transactionReader;
    private final AccountSnapshotCsvWriter snapshotWriter;

    public IngestionRunner(CommandRouterFactory commandRouterFactory,
                           TransactionCsvReader transactionReader,
                           AccountSnapshotCsvWriter snapshotWriter) {
        this.commandRouterFactory = commandRouterFactory;
        this.transactionReader = transactionReader;
        this.snapshotWriter = snapshotWriter;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> sources = args.getNonOptionArgs();
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("Missing source of transactions, usage: ledger <transactions.csv>");
        }
        Path source = Path.of(sources.get(0));
        if (!Files.isReadable(source)) {
            throw new IllegalArgumentException("Cannot read transactions from " + source);
        }
        try (InputStream input = Files.newInputStream(source)) {
            ingest(input, System.out);
        }
    }

    public IngestionReport ingest(InputStream input, OutputStream output) throws IOException {
        try (CommandRouter router = commandRouterFactory.create()) {
            long skipped = transactionReader.read(input, router::route);
            snapshotWriter.write(router.snapshot().values(), output);
            IngestionReport report = router.report();
            logger.info("Processed {} transactions: {} accepted, {} rejected {}, {} malformed",
                    report.processed(), report.accepted(), report.rejected(), report.rejections(), skipped);
            return report;
        }
    }
}
