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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.elasticsoftware.ledger.protocol.AccountRecord;
import org.elasticsoftware.ledger.protocol.TransactionRecord;

import java.math.BigDecimal;

public final class LedgerCsvMapper {
    private LedgerCsvMapper() {
    }

    public static CsvMapper create() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .disable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        SimpleModule module = new SimpleModule("LedgerCsvModule");
        module.addSerializer(BigDecimal.class, new BigDecimalSerializer());
        mapper.registerModule(module);
        return mapper;
    }

    /**
     * Schema for reading transactions, columns are resolved by the header names.
     */
    public static CsvSchema transactionReadSchema() {
        return CsvSchema.emptySchema().withHeader();
    }

    public static CsvSchema transactionWriteSchema(CsvMapper mapper) {
        return mapper.schemaFor(TransactionRecord.class).withHeader();
    }

    public static CsvSchema accountWriteSchema(CsvMapper mapper) {
        return mapper.schemaFor(AccountRecord.class).withHeader();
    }
}
