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

import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;
import org.elasticsoftware.ledger.util.EnvironmentPropertiesPrinter;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Random;

@SpringBootApplication
@EnableConfigurationProperties(GeneratorProperties.class)
public class GeneratorApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GeneratorApplication.class, args)));
    }

    @Bean(name = "ledgerTransactionGenerator")
    public TransactionGenerator transactionGenerator(GeneratorProperties properties) {
        Random random = properties.seed() != null ? new Random(properties.seed()) : new Random();
        return new TransactionGenerator(LedgerCsvMapper.create(), random, properties.clients(), properties.transactions());
    }

    @Bean(name = "ledgerGeneratorRunner")
    public GeneratorRunner generatorRunner(TransactionGenerator transactionGenerator) {
        return new GeneratorRunner(transactionGenerator);
    }

    @Bean(name = "environmentPropertiesPrinter")
    public EnvironmentPropertiesPrinter environmentPropertiesPrinter() {
        return new EnvironmentPropertiesPrinter();
    }
}
