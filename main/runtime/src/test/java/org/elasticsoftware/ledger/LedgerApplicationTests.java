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

import org.elasticsoftware.ledger.router.CommandRouter;
import org.elasticsoftware.ledger.router.CommandRouterFactory;
import org.elasticsoftware.ledger.router.IngestionReport;
import org.elasticsoftware.ledger.router.IngestionRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(args = "src/test/resources/transactions.csv")
public class LedgerApplicationTests {
    static final String EXPECTED_SNAPSHOT = """
            client,available,held,total,locked
            1,1.5000,0.0000,1.5000,false
            2,2.0000,0.0000,2.0000,false
            3,0.0000,0.0000,0.0000,true
            """;

    @Autowired
    private LedgerProperties properties;

    @Autowired
    private CommandRouterFactory commandRouterFactory;

    @Autowired
    private IngestionRunner ingestionRunner;

    static void assertExpectedIngestion(IngestionRunner ingestionRunner) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        IngestionReport report;
        try (InputStream input = LedgerApplicationTests.class.getResourceAsStream("/transactions.csv")) {
            assertNotNull(input);
            report = ingestionRunner.ingest(input, output);
        }

        assertEquals(EXPECTED_SNAPSHOT, output.toString(StandardCharsets.UTF_8));
        assertEquals(7L, report.accepted());
        assertEquals(2L, report.rejected());
        assertEquals(Map.of("InsufficientFundsError", 1L, "LockedAccountError", 1L), report.rejections());
    }

    @Test
    public void testContextLoads() {
        assertEquals(1, properties.partitions());
        assertEquals(10000, properties.queueCapacity());
        try (CommandRouter router = commandRouterFactory.create()) {
            assertInstanceOf(IngestionRouter.class, router);
        }
    }

    @Test
    public void testIngest() throws IOException {
        assertExpectedIngestion(ingestionRunner);
    }
}
