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
import org.elasticsoftware.ledger.account.commands.*;
import org.elasticsoftware.ledger.account.errors.*;
import org.elasticsoftware.ledger.account.events.*;
import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.annotations.AggregateInfo;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.IllegalEventException;

import java.util.*;

/**
 * Event sourced account of a single client.
 *
 * <p>The account keeps every applied event in order. Disputes refer back to the first credit or debit
 * with the same transaction id, resolves and chargebacks to the first hold. A chargeback locks the
 * account, after which every command is rejected.
 */
@AggregateInfo("Account")
public final class Account implements Aggregate<AccountState, AccountCommand, AccountEvent> {
    private final int client;
    private AccountState state;
    private long version = 0L;
    private final List<AccountEvent> events = new ArrayList<>();
    private final Set<AccountEvent> appliedEvents = new HashSet<>();
    // first credit or debit per tx
    private final Map<Long, TransactionEvent> genesisEvents = new HashMap<>();
    // first hold per tx
    private final Map<Long, HeldEvent> heldEvents = new HashMap<>();

    public Account(int client) {
        this.client = client;
        this.state = AccountState.open(client);
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(client);
    }

    public int getClient() {
        return client;
    }

    @Override
    public @NotNull AccountState getState() {
        return state;
    }

    @Override
    public long getVersion() {
        return version;
    }

    public List<AccountEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    @Override
    public @NotNull List<DomainEvent> handle(@NotNull AccountCommand command) {
        if (state.locked()) {
            return List.of(new AccountLockedErrorEvent(client, command.tx(), command.getType()));
        }
        if (command instanceof DepositCommand deposit) {
            return deposit(deposit);
        } else if (command instanceof WithdrawCommand withdraw) {
            return withdraw(withdraw);
        } else if (command instanceof DisputeCommand dispute) {
            return dispute(dispute);
        } else if (command instanceof ResolveCommand resolve) {
            return resolve(resolve);
        } else if (command instanceof ChargebackCommand chargeback) {
            return chargeback(chargeback);
        }
        throw new IllegalArgumentException("Unsupported command " + command.getClass().getName());
    }

    private List<DomainEvent> deposit(DepositCommand command) {
        if (command.amount() == null) {
            return List.of(new MissingAmountErrorEvent(client, command.tx(), command.getType()));
        }
        CreditedEvent event = new CreditedEvent(client, command.tx(), command.amount());
        if (appliedEvents.contains(event)) {
            return List.of(new DuplicateTransactionErrorEvent(client, command.tx(), command.getType()));
        }
        return List.of(event);
    }

    private List<DomainEvent> withdraw(WithdrawCommand command) {
        if (command.amount() == null) {
            return List.of(new MissingAmountErrorEvent(client, command.tx(), command.getType()));
        }
        DebitedEvent event = new DebitedEvent(client, command.tx(), command.amount());
        if (appliedEvents.contains(event)) {
            return List.of(new DuplicateTransactionErrorEvent(client, command.tx(), command.getType()));
        }
        if (command.amount().compareTo(state.available()) > 0) {
            return List.of(new InsufficientFundsErrorEvent(client, command.tx(), state.available(), command.amount()));
        }
        return List.of(event);
    }

    private List<DomainEvent> dispute(DisputeCommand command) {
        TransactionEvent genesis = genesisEvents.get(command.tx());
        if (genesis == null) {
            return List.of(new UnknownTransactionErrorEvent(client, command.tx()));
        }
        HeldEvent event = new HeldEvent(client, command.tx(), genesis.amount());
        if (appliedEvents.contains(event)) {
            return List.of(new DuplicateTransactionErrorEvent(client, command.tx(), command.getType()));
        }
        return List.of(event);
    }

    private List<DomainEvent> resolve(ResolveCommand command) {
        HeldEvent held = heldEvents.get(command.tx());
        if (held == null) {
            return List.of(new UnknownDisputeErrorEvent(client, command.tx(), command.getType()));
        }
        ReleasedEvent event = new ReleasedEvent(client, command.tx(), held.amount());
        if (appliedEvents.contains(event)) {
            return List.of(new DuplicateTransactionErrorEvent(client, command.tx(), command.getType()));
        }
        return List.of(event);
    }

    private List<DomainEvent> chargeback(ChargebackCommand command) {
        HeldEvent held = heldEvents.get(command.tx());
        if (held == null) {
            return List.of(new UnknownDisputeErrorEvent(client, command.tx(), command.getType()));
        }
        ReversedEvent event = new ReversedEvent(client, command.tx(), held.amount());
        if (appliedEvents.contains(event)) {
            return List.of(new DuplicateTransactionErrorEvent(client, command.tx(), command.getType()));
        }
        return List.of(event, new LockedEvent(client));
    }

    @Override
    public void apply(@NotNull List<? extends DomainEvent> domainEvents) {
        for (DomainEvent domainEvent : domainEvents) {
            // error events and foreign events never reach the state, neither does anything after a lock
            if (!(domainEvent instanceof AccountEvent event) || state.locked()) {
                throw new IllegalEventException(getName(), getAggregateId(), domainEvent);
            }
            state = next(event, state);
            if (event instanceof CreditedEvent || event instanceof DebitedEvent) {
                genesisEvents.putIfAbsent(((TransactionEvent) event).tx(), (TransactionEvent) event);
            } else if (event instanceof HeldEvent held) {
                heldEvents.putIfAbsent(held.tx(), held);
            }
            appliedEvents.add(event);
            events.add(event);
            version++;
        }
    }

    private static AccountState next(AccountEvent event, AccountState state) {
        if (event instanceof CreditedEvent credited) {
            return state.withBalances(state.available().add(credited.amount()), state.held());
        } else if (event instanceof DebitedEvent debited) {
            return state.withBalances(state.available().subtract(debited.amount()), state.held());
        } else if (event instanceof HeldEvent held) {
            return state.withBalances(state.available().subtract(held.amount()), state.held().add(held.amount()));
        } else if (event instanceof ReleasedEvent released) {
            return state.withBalances(state.available().add(released.amount()), state.held().subtract(released.amount()));
        } else if (event instanceof ReversedEvent reversed) {
            return state.withBalances(state.available(), state.held().subtract(reversed.amount()));
        } else if (event instanceof LockedEvent) {
            return state.lock();
        }
        throw new IllegalArgumentException("Unsupported event " + event.getClass().getName());
    }
}
