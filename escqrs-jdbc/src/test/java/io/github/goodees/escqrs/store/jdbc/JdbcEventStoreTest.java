package io.github.goodees.escqrs.store.jdbc;

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
import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.projection.Projection;
import io.github.goodees.escqrs.projection.ProjectionOptions;
import io.github.goodees.escqrs.store.ConcurrencyException;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.Snapshot;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Event store, snapshots and projection checkpoints working together over one database.
 */
public class JdbcEventStoreTest extends JdbcTest {
    private EventStore eventStore;

    @Before
    public void createEventStore() {
        eventStore = new EventStore(repository, snapshotStore, new EventVersionManager(), serialization);
    }

    @Test
    public void saved_events_read_back_equal() throws EventStoreException {
        List<DomainEvent> events = Arrays.asList(domainEvent(1, "Opened", 0), domainEvent(2, "Deposited", 100));
        eventStore.saveEvents(name(), events, 0);
        eventStore.clearCache();
        assertEquals(events, eventStore.getEvents(name(), AGGREGATE_TYPE));
        assertEquals(2, eventStore.getCurrentVersion(name(), AGGREGATE_TYPE));
    }

    @Test
    public void stale_writer_is_rejected() throws EventStoreException {
        eventStore.saveEvents(name(), Collections.singletonList(domainEvent(1, "Opened", 0)), 0);
        try {
            eventStore.saveEvents(name(), Collections.singletonList(domainEvent(1, "Opened", 0)), 0);
            fail("should have failed");
        } catch (ConcurrencyException e) {
            assertEquals(0, e.getExpectedVersion());
            assertEquals(1, e.getActualVersion());
        }
    }

    @Test
    public void snapshot_survives_round_trip_with_intact_checksum() throws EventStoreException {
        Map<String, Object> state = Collections.singletonMap("balance", 100);
        eventStore.createSnapshot(name(), AGGREGATE_TYPE, 2, state);
        Optional<Snapshot> snapshot = eventStore.getSnapshot(name(), AGGREGATE_TYPE);
        assertTrue(snapshot.isPresent());
        assertEquals(state, snapshot.get().getData());
    }

    @Test
    public void projection_resumes_from_stored_checkpoint() throws EventStoreException {
        eventStore.saveEvents(name(), Arrays.asList(domainEvent(1, "Opened", 0), domainEvent(2, "Deposited", 100),
                domainEvent(3, "Deposited", 50)), 0);
        ProjectionOptions options = ProjectionOptions.builder()
                .subscriptionFilter(EventFilter.builder().aggregateIds(name()).build()).checkpointInterval(1)
                .build();

        BalanceProjection first = new BalanceProjection(options);
        first.start();
        first.stop();
        assertEquals(150, first.balance);
        long position = checkpointStore.load(name()).get().getPosition();
        assertEquals(first.getLastPosition(), position);

        eventStore.saveEvents(name(), Collections.singletonList(domainEvent(4, "Deposited", 25)), 3);
        BalanceProjection second = new BalanceProjection(options);
        second.start();
        second.stop();
        assertEquals(25, second.balance);
        assertEquals(1, second.getStats().getEventsProcessed());
    }

    class BalanceProjection extends Projection {
        int balance;

        BalanceProjection(ProjectionOptions options) {
            super(JdbcEventStoreTest.this.eventStore, JdbcEventStoreTest.this.checkpointStore, options);
        }

        @Override
        public String getName() {
            return name();
        }

        @Override
        public boolean canHandle(DomainEvent event) {
            return event.getEventType().equals("Deposited");
        }

        @Override
        protected void handle(RecordedEvent event) {
            balance += ((Number) event.getEvent().getEventData().get("amount")).intValue();
        }
    }
}
