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

import io.github.goodees.escqrs.LogCapture;
import io.github.goodees.escqrs.event.DomainEvent;
import io.github.goodees.escqrs.event.TestEvents;
import io.github.goodees.escqrs.store.Snapshot;
import io.github.goodees.escqrs.store.SnapshotMetadata;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static java.util.stream.Collectors.toList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AggregateRootTest {
    @Rule
    public LogCapture log = new LogCapture(BankAccount.class);

    private BankAccount account;

    @Before
    public void setUp() {
        account = new BankAccount("acc-1");
    }

    @Test
    public void raised_events_are_applied_and_buffered() {
        account.open("Jane");
        account.deposit(100);
        account.withdraw(30);

        assertEquals(70, account.getBalance());
        assertEquals(3, account.getVersion());
        assertEquals(3, account.raisedEvents);
        List<DomainEvent> uncommitted = account.getUncommittedEvents();
        assertThat(uncommitted.stream().map(DomainEvent::getVersion).collect(toList()), contains(1L, 2L, 3L));
        assertThat(uncommitted.stream().map(DomainEvent::getEventType).collect(toList()),
                contains("AccountOpened", "MoneyDeposited", "MoneyWithdrawn"));
        DomainEvent first = uncommitted.get(0);
        assertEquals("acc-1", first.getAggregateId());
        assertEquals(BankAccount.TYPE, first.getAggregateType());
        assertEquals("1.0", first.getSchemaVersion());
    }

    @Test
    public void rejected_command_raises_nothing() {
        account.deposit(10);
        try {
            account.withdraw(20);
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertEquals(1, account.getVersion());
        assertEquals(1, account.getUncommittedEvents().size());
    }

    @Test
    public void committed_events_leave_buffer_but_keep_version() {
        account.deposit(10);
        account.markEventsAsCommitted();
        assertFalse(account.hasUncommittedEvents());
        assertEquals(1, account.getVersion());
        account.deposit(5);
        assertEquals(2, account.getUncommittedEvents().get(0).getVersion());
    }

    @Test
    public void metadata_overrides_take_precedence() {
        account.deposit(10, "corr-42");
        DomainEvent event = account.getUncommittedEvents().get(0);
        assertEquals("corr-42", event.getMetadata().getCorrelationId());
        assertEquals("teller", event.getMetadata().getUserId());
        assertEquals("BankAccount", event.getMetadata().getSource());
    }

    @Test
    public void clock_and_id_generator_are_used_for_new_events() {
        Instant fixed = Instant.parse("2017-06-01T10:00:00Z");
        AtomicInteger ids = new AtomicInteger();
        account.setClock(Clock.fixed(fixed, ZoneOffset.UTC));
        account.setIdGenerator(() -> "id-" + ids.incrementAndGet());
        account.deposit(10);
        DomainEvent event = account.getUncommittedEvents().get(0);
        assertEquals(fixed, event.getTimestamp());
        assertThat(event.getId(), startsWith("id-"));
    }

    @Test
    public void history_is_replayed_without_buffering() {
        account.loadFromHistory(Arrays.asList(
                TestEvents.event("acc-1", 1, "AccountOpened").put("owner", "Jane").build(),
                TestEvents.event("acc-1", 2, "MoneyDeposited").put("amount", 40).build()));
        assertEquals("Jane", account.getOwner());
        assertEquals(40, account.getBalance());
        assertEquals(2, account.getVersion());
        assertEquals(2, account.replayedEvents);
        assertEquals(0, account.raisedEvents);
        assertFalse(account.hasUncommittedEvents());
    }

    @Test
    public void unknown_event_type_is_skipped_with_warning() {
        account.loadFromHistory(Arrays.asList(
                TestEvents.event("acc-1", 1, "MoneyDeposited").put("amount", 40).build(),
                TestEvents.event("acc-1", 2, "InterestAccrued").put("amount", 1).build()));
        assertEquals(40, account.getBalance());
        assertEquals(2, account.getVersion());
        assertThat(log.warnings(), hasItem(startsWith("No handler for event type InterestAccrued")));
    }

    @Test
    public void snapshot_contains_identity_and_state() {
        account.open("Jane");
        account.deposit(25);
        Map<String, Object> state = account.createSnapshot();
        assertThat(state, hasEntry("id", (Object) "acc-1"));
        assertThat(state, hasEntry("version", (Object) 2L));
        assertThat(state, hasEntry("balance", (Object) 25));
    }

    @Test
    public void snapshot_restores_state_and_version() {
        assertTrue(account.restoreFromSnapshot(snapshot("acc-1", 7, stateWithBalance(300))));
        assertEquals(300, account.getBalance());
        assertEquals(7, account.getVersion());
        account.deposit(1);
        assertEquals(8, account.getUncommittedEvents().get(0).getVersion());
    }

    @Test
    public void unrecognized_snapshot_is_refused() {
        assertFalse(account.restoreFromSnapshot(snapshot("acc-1", 7, Collections.singletonMap("funds", "lots"))));
        assertEquals(0, account.getVersion());
    }

    @Test(expected = IllegalArgumentException.class)
    public void snapshot_of_other_aggregate_is_rejected() {
        account.restoreFromSnapshot(snapshot("acc-2", 7, stateWithBalance(1)));
    }

    private static Map<String, Object> stateWithBalance(int balance) {
        return Collections.singletonMap("balance", balance);
    }

    private static Snapshot snapshot(String id, long version, Map<String, Object> data) {
        return new Snapshot(id, BankAccount.TYPE, version, data, Instant.now(), SnapshotMetadata.describe("{}", "json"));
    }
}
