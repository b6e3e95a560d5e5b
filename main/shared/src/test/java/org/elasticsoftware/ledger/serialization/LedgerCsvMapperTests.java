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

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.elasticsoftware.ledger.protocol.AccountRecord;
import org.elasticsoftware.ledger.protocol.TransactionRecord;
import org.elasticsoftware.ledger.util.Amounts;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerCsvMapperTests {
    private final CsvMapper mapper = LedgerCsvMapper.create();

    @Test
    public void testReadRowsWithWhitespaceAndMissingAmount() throws IOException {
        String csv = """
                type, client, tx, amount
                deposit, 1, 1, 1.0
                withdraw,  2,2,  0.5
                dispute, 1, 1,
                """;
        List<Map<String, String>> rows;
        try (MappingIterator<Map<String, String>> iterator = mapper.readerForMapOf(String.class)
                .with(LedgerCsvMapper.transactionReadSchema())
                .readValues(csv)) {
            rows = iterator.readAll();
        }

        assertEquals(3, rows.size());
        assertEquals(Map.of("type", "deposit", "client", "1", "tx", "1", "amount", "1.0"), rows.get(0));
        assertEquals("0.5", rows.get(1).get("amount"));
        assertEquals("dispute", rows.get(2).get("type"));
        assertNull(rows.get(2).get("amount"));
    }

    @Test
    public void testReadRowsWithReorderedColumns() throws IOException {
        String csv = """
                client,type,amount,tx
                7,deposit,3.25,11
                """;
        try (MappingIterator<Map<String, String>> iterator = mapper.readerForMapOf(String.class)
                .with(LedgerCsvMapper.transactionReadSchema())
                .readValues(csv)) {
            Map<String, String> row = iterator.next();
            assertEquals("deposit", row.get("type"));
            assertEquals("11", row.get("tx"));
        }
    }

    @Test
    public void testWriteAccountRecordsWithFourFractionalDigits() throws IOException {
        String csv = mapper.writer(LedgerCsvMapper.accountWriteSchema(mapper))
                .writeValueAsString(new AccountRecord(1, Amounts.parse("1.5"), Amounts.ZERO, Amounts.parse("1.5"), false));

        assertEquals("client,available,held,total,locked\n1,1.5000,0.0000,1.5000,false\n", csv);
    }

    @Test
    public void testWriteTransactionRecordWithoutAmount() throws IOException {
        String csv = mapper.writer(LedgerCsvMapper.transactionWriteSchema(mapper))
                .writeValueAsString(new TransactionRecord("dispute", 3, 4L, null));

        assertEquals("type,client,tx,amount\ndispute,3,4,\n", csv);
    }
}
