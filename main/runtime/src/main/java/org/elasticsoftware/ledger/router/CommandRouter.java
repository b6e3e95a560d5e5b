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

import org.elasticsoftware.ledger.account.AccountState;
import org.elasticsoftware.ledger.account.commands.AccountCommand;

import java.util.Map;

/**
 * Routes commands to the account of their client. Commands of the same client are always handled in
 * the order in which they were routed.
 */
public interface CommandRouter extends AutoCloseable {
    void route(AccountCommand command);

    /**
     * @return the balances of every account seen so far, keyed by client id
     */
    Map<Integer, AccountState> snapshot();

    IngestionReport report();

    @Override
    default void close() {
    }
}
