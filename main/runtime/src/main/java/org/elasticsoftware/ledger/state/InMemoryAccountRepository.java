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

import org.elasticsoftware.ledger.account.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class InMemoryAccountRepository implements AccountRepository {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryAccountRepository.class);
    private final Map<Integer, Account> accounts = new HashMap<>();

    @Override
    public Account get(int client) {
        return accounts.get(client);
    }

    @Override
    public Account getOrCreate(int client) {
        return accounts.computeIfAbsent(client, id -> {
            logger.trace("Opening Account for client {}", id);
            return new Account(id);
        });
    }

    @Override
    public Collection<Account> values() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    @Override
    public int size() {
        return accounts.size();
    }
}
