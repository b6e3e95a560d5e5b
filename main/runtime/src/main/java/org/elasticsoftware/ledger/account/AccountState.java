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

package org.elasticsoftware.ledger.account;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.aggregate.AggregateState;
import org.elasticsoftware.ledger.util.Amounts;

import java.math.BigDecimal;

/**
 * Balances of a single client account. {@code total} always equals {@code available + held}.
 */
public record AccountState(
        int client,
        @NotNull BigDecimal available,
        @NotNull BigDecimal held,
        @NotNull BigDecimal total,
        boolean locked
) implements AggregateState {
    public static AccountState open(int client) {
        return new AccountState(client, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, false);
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(client());
    }

    public AccountState withBalances(BigDecimal available, BigDecimal held) {
        return new AccountState(client, available, held, available.add(held), locked);
    }

    public AccountState lock() {
        return new AccountState(client, available, held, total, true);
    }
}
