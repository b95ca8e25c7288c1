package io.github.goodees.escqrs.aggregate;

/*-
 * #%L
 * escqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.escqrs.event.DomainEvent;
import io.github.goodees.escqrs.event.EventMetadata;
import io.github.goodees.escqrs.matching.EventHandlers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

class BankAccount extends AggregateRoot {
    static final String TYPE = "BankAccount";

    private String owner;
    private int balance;
    int replayedEvents;
    int raisedEvents;

    BankAccount(String id) {
        super(id);
    }

    void open(String owner) {
        if (getVersion() > 0) {
            throw new IllegalStateException("Account " + getId() + " is already open");
        }
        raiseEvent("AccountOpened", Collections.singletonMap("owner", owner));
    }

    void deposit(int amount) {
        raiseEvent("MoneyDeposited", Collections.singletonMap("amount", amount));
    }

    void deposit(int amount, String correlationId) {
        raiseEvent("MoneyDeposited", Collections.singletonMap("amount", amount),
                EventMetadata.builder().correlationId(correlationId).userId("teller").build());
    }

    void withdraw(int amount) {
        if (amount > balance) {
            throw new IllegalArgumentException("Insufficient funds");
        }
        raiseEvent("MoneyWithdrawn", Collections.singletonMap("amount", amount));
    }

    @Override
    protected void registerHandlers(EventHandlers.Builder handlers) {
        handlers.on("AccountOpened", e -> {
            owner = (String) e.getEventData().get("owner");
            count();
        })
                .on("MoneyDeposited", e -> {
                    balance += amount(e);
                    count();
                })
                .on("MoneyWithdrawn", e -> {
                    balance -= amount(e);
                    count();
                });
    }

    private void count() {
        if (isReplaying()) {
            replayedEvents++;
        }
    }

    @Override
    protected void onEventRaised(DomainEvent event) {
        raisedEvents++;
    }

    private static int amount(DomainEvent e) {
        return ((Number) e.getEventData().get("amount")).intValue();
    }

    @Override
    public String getAggregateType() {
        return TYPE;
    }

    @Override
    protected Map<String, Object> snapshotState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("owner", owner);
        state.put("balance", balance);
        return state;
    }

    @Override
    protected boolean restoreState(Map<String, Object> state) {
        if (!(state.get("balance") instanceof Number)) {
            return false;
        }
        owner = (String) state.get("owner");
        balance = ((Number) state.get("balance")).intValue();
        return true;
    }

    String getOwner() {
        return owner;
    }

    int getBalance() {
        return balance;
    }
}
