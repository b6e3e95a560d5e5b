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

package org.elasticsoftware.ledger.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class BigDecimalSerializerTests {

    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        objectMapper = new ObjectMapper();
        SimpleModule module = new SimpleModule();
        module.addSerializer(BigDecimal.class, new BigDecimalSerializer());
        objectMapper.registerModule(module);
    }

    @Test
    public void testSerializePadsToFourDigits() throws IOException {
        assertEquals("123.4500", objectMapper.writeValueAsString(new BigDecimal("123.45")));
        assertEquals("7.0000", objectMapper.writeValueAsString(new BigDecimal("7")));
    }

    @Test
    public void testSerializeScientificNotation() throws IOException {
        assertEquals("10000000000.0000", objectMapper.writeValueAsString(new BigDecimal("1E+10")));
    }

    @Test
    public void testSerializeZeroAndNegative() throws IOException {
        assertEquals("0.0000", objectMapper.writeValueAsString(BigDecimal.ZERO));
        assertEquals("-999.9900", objectMapper.writeValueAsString(new BigDecimal("-999.99")));
    }

    @Test
    public void testSerializeTooManyDigitsFails() {
        // the serializer never rounds
        assertThrows(Exception.class, () -> objectMapper.writeValueAsString(new BigDecimal("0.12345")));
    }
}
