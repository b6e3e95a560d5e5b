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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IngestionReportTests {
    @Test
    public void testMerge() {
        IngestionReport merged = IngestionReport.merge(List.of(
                new IngestionReport(3L, 2L, Map.of("InsufficientFundsError", 2L)),
                IngestionReport.EMPTY,
                new IngestionReport(1L, 3L, Map.of("InsufficientFundsError", 1L, "UnknownTransactionError", 2L))));

        assertEquals(4L, merged.accepted());
        assertEquals(5L, merged.rejected());
        assertEquals(9L, merged.processed());
        assertEquals(Map.of("InsufficientFundsError", 3L, "UnknownTransactionError", 2L), merged.rejections());
    }

    @Test
    public void testRejectionsAreCopied() {
        Map<String, Long> rejections = new HashMap<>();
        rejections.put("UnknownTransactionError", 1L);
        IngestionReport report = new IngestionReport(0L, 1L, rejections);
        rejections.put("UnknownTransactionError", 2L);

        assertEquals(1L, report.rejections().get("UnknownTransactionError"));
        assertThrows(UnsupportedOperationException.class, () -> report.rejections().clear());
    }
}
