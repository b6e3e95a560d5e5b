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

package org.elasticsoftware.ledger.csv;

import org.elasticsoftware.ledger.account.AccountState;
import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;
import org.elasticsoftware.ledger.util.Amounts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AccountSnapshotCsvWriterTests {
    private final AccountSnapshotCsvWriter writer = new AccountSnapshotCsvWriter(LedgerCsvMapper.create());

    private String write(List<AccountState> accounts) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        writer.write(accounts, output);
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testWriteSortedByClient() throws IOException {
        List<AccountState> accounts = List.of(
                AccountState.open(2).withBalances(Amounts.parse("2"), Amounts.ZERO),
                AccountState.open(1).withBalances(Amounts.parse("0.5"), Amounts.parse("1.25")).lock());

        assertEquals("""
                client,available,held,total,locked
                1,0.5000,1.2500,1.7500,true
                2,2.0000,0.0000,2.0000,false
                """, write(accounts));
    }

    @Test
    public void testWriteNegativeBalances() throws IOException {
        List<AccountState> accounts = List.of(AccountState.open(3).withBalances(Amounts.parse("5"), Amounts.parse("-5")));

        assertEquals("client,available,held,total,locked\n3,5.0000,-5.0000,0.0000,false\n", write(accounts));
    }
}
