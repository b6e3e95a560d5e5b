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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.elasticsoftware.ledger.account.AccountState;
import org.elasticsoftware.ledger.protocol.AccountRecord;
import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.Comparator;

/**
 * Writes account balances as {@code client,available,held,total,locked} rows, ordered by client.
 */
public class AccountSnapshotCsvWriter {
    private final CsvMapper mapper;

    public AccountSnapshotCsvWriter(CsvMapper mapper) {
        this.mapper = mapper;
    }

    public void write(Collection<AccountState> accounts, OutputStream output) throws IOException {
        try (SequenceWriter writer = mapper.writer(LedgerCsvMapper.accountWriteSchema(mapper))
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(output)) {
            for (AccountState account : accounts.stream().sorted(Comparator.comparingInt(AccountState::client)).toList()) {
                writer.write(toRecord(account));
            }
        }
        output.flush();
    }

    static AccountRecord toRecord(AccountState state) {
        return new AccountRecord(state.client(), state.available(), state.held(), state.total(), state.locked());
    }
}
