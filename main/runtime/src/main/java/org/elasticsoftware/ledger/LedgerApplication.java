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

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.elasticsoftware.ledger.csv.AccountSnapshotCsvWriter;
import org.elasticsoftware.ledger.csv.TransactionCsvReader;
import org.elasticsoftware.ledger.router.CommandRouterFactory;
import org.elasticsoftware.ledger.router.IngestionRouter;
import org.elasticsoftware.ledger.router.PartitionedIngestionRouter;
import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;
import org.elasticsoftware.ledger.state.AccountRepositoryFactory;
import org.elasticsoftware.ledger.state.InMemoryAccountRepositoryFactory;
import org.elasticsoftware.ledger.util.EnvironmentPropertiesPrinter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LedgerApplication.class, args)));
    }

    @Bean(name = "ledgerCsvMapper")
    public CsvMapper csvMapper() {
        return LedgerCsvMapper.create();
    }

    @Bean(name = "ledgerAccountRepositoryFactory")
    public AccountRepositoryFactory accountRepositoryFactory() {
        return new InMemoryAccountRepositoryFactory();
    }

    @Bean(name = "ledgerCommandRouterFactory")
    public CommandRouterFactory commandRouterFactory(LedgerProperties properties,
                                                     AccountRepositoryFactory accountRepositoryFactory) {
        if (properties.partitions() > 1) {
            return () -> new PartitionedIngestionRouter(properties.partitions(), properties.queueCapacity(), accountRepositoryFactory);
        }
        return () -> new IngestionRouter(accountRepositoryFactory.create(0));
    }

    @Bean(name = "ledgerTransactionReader")
    public TransactionCsvReader transactionReader(CsvMapper csvMapper) {
        return new TransactionCsvReader(csvMapper);
    }

    @Bean(name = "ledgerSnapshotWriter")
    public AccountSnapshotCsvWriter snapshotWriter(CsvMapper csvMapper) {
        return new AccountSnapshotCsvWriter(csvMapper);
    }

    @Bean(name = "ledgerIngestionRunner")
    public IngestionRunner ingestionRunner(CommandRouterFactory commandRouterFactory,
                                           TransactionCsvReader transactionReader,
                                           AccountSnapshotCsvWriter snapshotWriter) {
        return new IngestionRunner(commandRouterFactory, transactionReader, snapshotWriter);
    }

    @Bean(name = "environmentPropertiesPrinter")
    public EnvironmentPropertiesPrinter environmentPropertiesPrinter() {
        return new EnvironmentPropertiesPrinter();
    }
}
