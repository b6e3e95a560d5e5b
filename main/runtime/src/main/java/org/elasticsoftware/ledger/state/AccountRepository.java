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

package org.elasticsoftware.ledger.state;

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.account.Account;

import java.util.Collection;

/**
 * Owns the {@link Account} aggregates of one ingestion run, keyed by client id.
 */
public interface AccountRepository {
    @Nullable Account get(int client);

    /**
     * Returns the account of the client, opening a new one on first reference.
     */
    Account getOrCreate(int client);

    Collection<Account> values();

    int size();
}
