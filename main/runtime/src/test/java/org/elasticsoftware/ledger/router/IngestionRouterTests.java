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
import org.elasticsoftware.ledger.account.commands.*;
import org.elasticsoftware.ledger.account.errors.AccountLockedErrorEvent;
import org.elasticsoftware.ledger.account.errors.InsufficientFundsErrorEvent;
import org.elasticsoftware.ledger.account.errors.UnknownTransactionErrorEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.state.InMemoryAccountRepository;
import org.elasticsoftware.ledger.util.Amounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class IngestionRouterTests {
    private InMemoryAccountRepository repository;
    private Consumer<ErrorEvent> errorEventConsumer;
    private IngestionRouter router;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        repository = new InMemoryAccountRepository();
        errorEventConsumer = mock(Consumer.class);
        router = new IngestionRouter(repository, errorEventConsumer);
    }

    @Test
    public void testAccountsAreCreatedOnFirstReference() {
        router.route(new DepositCommand(1, 1L, Amounts.parse("1.0")));
        router.route(new DisputeCommand(2, 2L));

        assertEquals(2, repository.size());
        assertNotNull(repository.get(2));
        assertNull(repository.get(3));
        // the rejected dispute still opened an empty account
        assertEquals(AccountState.open(2), router.snapshot().get(2));
        verify(errorEventConsumer).accept(new UnknownTransactionErrorEvent(2, 2L));
    }

    @Test
    public void testCommandsAreRoutedToTheirOwnClient() {
        router.route(new DepositCommand(1, 1L, Amounts.parse("1.0")));
        router.route(new DepositCommand(2, 2L, Amounts.parse("2.0")));
        router.route(new DepositCommand(1, 3L, Amounts.parse("2.0")));
        router.route(new WithdrawCommand(1, 4L, Amounts.parse("1.5")));
        router.route(new WithdrawCommand(2, 5L, Amounts.parse("3.0")));

        Map<Integer, AccountState> snapshot = router.snapshot();
        assertEquals(2, snapshot.size());
        assertEquals(Amounts.parse("1.5"), snapshot.get(1).available());
        assertEquals(Amounts.parse("1.5"), snapshot.get(1).total());
        assertEquals(Amounts.parse("2.0"), snapshot.get(2).available());
        assertEquals(Amounts.parse("2.0"), snapshot.get(2).total());
        verify(errorEventConsumer).accept(new InsufficientFundsErrorEvent(2, 5L, Amounts.parse("2"), Amounts.parse("3")));
        verifyNoMoreInteractions(errorEventConsumer);
    }

    @Test
    public void testReportCountsAcceptedAndRejectedCommands() {
        router.route(new DepositCommand(1, 1L, Amounts.parse("10")));
        router.route(new WithdrawCommand(1, 2L, Amounts.parse("20")));
        router.route(new DisputeCommand(1, 1L));
        router.route(new ChargebackCommand(1, 1L));
        router.route(new DepositCommand(1, 3L, Amounts.parse("5")));
        router.route(new ResolveCommand(1, 1L));

        IngestionReport report = router.report();
        assertEquals(3L, report.accepted());
        assertEquals(3L, report.rejected());
        assertEquals(6L, report.processed());
        assertEquals(Map.of("InsufficientFundsError", 1L, "LockedAccountError", 2L), report.rejections());
        verify(errorEventConsumer).accept(new AccountLockedErrorEvent(1, 3L, "deposit"));
        verify(errorEventConsumer).accept(new AccountLockedErrorEvent(1, 1L, "resolve"));
        assertTrue(router.snapshot().get(1).locked());
    }

    @Test
    public void testEmptyRouter() {
        assertTrue(router.snapshot().isEmpty());
        assertEquals(IngestionReport.EMPTY, router.report());
        verifyNoInteractions(errorEventConsumer);
    }
}
