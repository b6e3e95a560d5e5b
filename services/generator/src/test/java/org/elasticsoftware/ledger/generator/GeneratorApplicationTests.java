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

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = {
        "ledger.generator.clients=5",
        "ledger.generator.transactions=20",
        "ledger.generator.seed=42"})
public class GeneratorApplicationTests {
    @Autowired
    private GeneratorProperties properties;

    @Autowired
    private TransactionGenerator transactionGenerator;

    @Test
    public void testPropertiesAreBound() {
        assertEquals(5, properties.clients());
        assertEquals(20L, properties.transactions());
        assertEquals(42L, properties.seed());
    }

    @Test
    public void testGenerate() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        assertEquals(20L, transactionGenerator.generate(output));
        assertEquals(21, output.toString(StandardCharsets.UTF_8).lines().count());
    }
}
