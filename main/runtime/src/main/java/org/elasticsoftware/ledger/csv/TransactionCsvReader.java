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

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.elasticsoftware.ledger.account.commands.*;
import org.elasticsoftware.ledger.aggregate.CommandType;
import org.elasticsoftware.ledger.protocol.TransactionRecord;
import org.elasticsoftware.ledger.serialization.LedgerCsvMapper;
import org.elasticsoftware.ledger.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads transaction rows and turns them into {@link AccountCommand}s. Rows that do not follow the wire
 * format are logged and skipped, they never reach an account.
 */
public class TransactionCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(TransactionCsvReader.class);
    static final long MAX_CLIENT = 0xFFFFL;
    static final long MAX_TX = 0xFFFFFFFFL;
    static final int MAX_INTEGER_DIGITS = 28;
    private static final Map<String, AccountCommandFactory> commandFactories = Map.of(
            CommandType.of(DepositCommand.class).typeName(), DepositCommand::new,
            CommandType.of(WithdrawCommand.class).typeName(), WithdrawCommand::new,
            CommandType.of(DisputeCommand.class).typeName(), (client, tx, amount) -> new DisputeCommand(client, tx),
            CommandType.of(ResolveCommand.class).typeName(), (client, tx, amount) -> new ResolveCommand(client, tx),
            CommandType.of(ChargebackCommand.class).typeName(), (client, tx, amount) -> new ChargebackCommand(client, tx));
    private final CsvMapper mapper;

    public TransactionCsvReader(CsvMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Passes every well formed row, in input order, to the consumer.
     *
     * @return the number of skipped rows
     */
    public long read(InputStream input, Consumer<AccountCommand> consumer) throws IOException {
        long skipped = 0L;
        PushbackInputStream source = new PushbackInputStream(input, 1);
        if (!hasContent(source)) {
            // no header line, nothing to read
            return skipped;
        }
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(LedgerCsvMapper.transactionReadSchema())
                .readValues(source)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                AccountCommand command;
                try {
                    command = toCommand(toRecord(row));
                } catch (MalformedTransactionException e) {
                    skipped++;
                    logger.warn("Skipping transaction on line {}: {}", rows.getCurrentLocation().getLineNr(), e.getMessage());
                    continue;
                }
                consumer.accept(command);
            }
        }
        return skipped;
    }

    /**
     * Skips leading blank lines and tells whether anything is left to read.
     */
    private static boolean hasContent(PushbackInputStream source) throws IOException {
        int next;
        do {
            next = source.read();
        } while (next == ' ' || next == '\t' || next == '\r' || next == '\n');
        if (next == -1) {
            return false;
        }
        source.unread(next);
        return true;
    }

    static TransactionRecord toRecord(Map<String, String> row) {
        String type = required(row, "type");
        int client = (int) parseUnsigned(required(row, "client"), "client", MAX_CLIENT);
        long tx = parseUnsigned(required(row, "tx"), "tx", MAX_TX);
        String amount = row.get("amount");
        return new TransactionRecord(type, client, tx, amount == null || amount.isBlank() ? null : parseAmount(amount));
    }

    static AccountCommand toCommand(TransactionRecord record) {
        AccountCommandFactory factory = commandFactories.get(record.type());
        if (factory == null) {
            throw new MalformedTransactionException("unknown transaction type '" + record.type() + "'");
        }
        return factory.create(record.client(), record.tx(), record.amount());
    }

    private static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new MalformedTransactionException("missing " + column);
        }
        return value.trim();
    }

    private static long parseUnsigned(String value, String column, long max) {
        long result;
        try {
            result = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new MalformedTransactionException(column + " '" + value + "' is not a number");
        }
        if (result < 0 || result > max) {
            throw new MalformedTransactionException(column + " " + result + " is out of range [0, " + max + "]");
        }
        return result;
    }

    private static BigDecimal parseAmount(String value) {
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedTransactionException("amount '" + value + "' is not a decimal");
        }
        if (amount.signum() < 0) {
            throw new MalformedTransactionException("amount " + amount + " is negative");
        }
        if (!Amounts.isRepresentable(amount)) {
            throw new MalformedTransactionException("amount " + amount + " has more than " + Amounts.SCALE + " fractional digits");
        }
        // long arithmetic, exponents may be close to Integer.MAX_VALUE
        if ((long) amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new MalformedTransactionException("amount " + value.trim() + " has more than " + MAX_INTEGER_DIGITS + " integer digits");
        }
        return Amounts.normalize(amount);
    }

    @FunctionalInterface
    interface AccountCommandFactory {
        AccountCommand create(int client, long tx, BigDecimal amount);
    }
}
