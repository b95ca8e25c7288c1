package io.github.goodees.escqrs.projection;

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
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.event.TestEvents;
import io.github.goodees.escqrs.projection.inmemory.InMemoryCheckpointStore;
import io.github.goodees.escqrs.store.EventChannels;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.JacksonSerialization;
import io.github.goodees.escqrs.store.inmemory.InMemorySnapshotStore;
import io.github.goodees.escqrs.store.inmemory.InMemoryStorageRepository;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.goodees.escqrs.event.TestEvents.deposited;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ProjectionTest {
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private EventStore eventStore;
    private InMemoryCheckpointStore checkpointStore;
    private ProjectionOptions.Builder options;

    @Before
    public void setUp() {
        eventStore = new EventStore(new InMemoryStorageRepository(), new InMemorySnapshotStore(),
                new EventVersionManager(), new JacksonSerialization());
        checkpointStore = new InMemoryCheckpointStore();
        options = ProjectionOptions.builder().retryDelay(1);
    }

    private BalanceProjection projection() {
        return new BalanceProjection("balances", eventStore, checkpointStore, options.build());
    }

    private List<RecordedEvent> save(String account, long expectedVersion, int... amounts)
            throws EventStoreException {
        List<DomainEvent> events = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            events.add(deposited(account, expectedVersion + i + 1, amounts[i]));
        }
        return eventStore.saveEvents(account, events, expectedVersion);
    }

    @Test
    public void existing_events_caught_up_on_start() throws EventStoreException {
        save("a", 0, 10, 20);
        List<RecordedEvent> last = save("b", 0, 5);
        BalanceProjection projection = projection();
        projection.start();

        collector.checkThat(projection.balance("a"), is(30));
        collector.checkThat(projection.balance("b"), is(5));
        collector.checkThat(projection.getStats().getEventsProcessed(), is(3L));
        collector.checkThat(projection.getLastPosition(), is(last.get(0).getPosition()));
        collector.checkThat(checkpointStore.load("balances").get().getPosition(), is(last.get(0).getPosition()));
        collector.checkThat(projection.isRunning(), is(true));
    }

    @Test
    public void live_events_processed_after_start() throws EventStoreException {
        BalanceProjection projection = projection();
        projection.start();
        save("a", 0, 10);
        save("a", 1, 15);
        assertEquals(25, projection.balance("a"));

        projection.stop();
        save("a", 2, 100);
        assertEquals(25, projection.balance("a"));
        assertFalse(projection.isRunning());
    }

    @Test
    public void catch_up_reads_in_batches() throws EventStoreException {
        save("a", 0, 1, 1, 1, 1, 1);
        options.bufferSize(2);
        BalanceProjection projection = projection();
        projection.start();
        assertEquals(5, projection.balance("a"));
        assertEquals(5, projection.positions.size());
    }

    @Test
    public void events_it_cannot_handle_still_advance_position() throws EventStoreException {
        List<RecordedEvent> saved = eventStore.saveEvents("a", Arrays.asList(deposited("a", 1, 10),
                TestEvents.event("a", 2, "Renamed").put("name", "savings").build()), 0);
        BalanceProjection projection = projection();
        projection.start();
        assertEquals(saved.get(1).getPosition(), projection.getLastPosition());
        assertEquals(1, projection.getStats().getEventsProcessed());
    }

    @Test
    public void start_resumes_after_checkpoint() throws EventStoreException {
        List<RecordedEvent> first = save("a", 0, 10, 20);
        save("a", 2, 40);
        checkpointStore.save(Checkpoint.of("balances", first.get(1).getPosition(), Instant.now()));
        BalanceProjection projection = projection();
        projection.start();
        assertEquals(40, projection.balance("a"));
        assertEquals(1, projection.getStats().getEventsProcessed());
    }

    @Test
    public void checkpoint_saved_every_interval() throws EventStoreException {
        options.checkpointInterval(2);
        BalanceProjection projection = projection();
        projection.start();
        List<RecordedEvent> first = save("a", 0, 1);
        assertFalse(checkpointStore.load("balances").isPresent());
        List<RecordedEvent> second = save("a", 1, 1);
        assertEquals(second.get(0).getPosition(), checkpointStore.load("balances").get().getPosition());
        assertTrue(first.get(0).getPosition() < second.get(0).getPosition());
    }

    @Test
    public void event_written_during_catch_up_processed_once() throws EventStoreException {
        save("a", 0, 10);
        BalanceProjection projection = projection();
        projection.onHandle = () -> {
            try {
                save("b", 0, 7);
            } catch (EventStoreException e) {
                throw new IllegalStateException(e);
            }
        };
        projection.start();
        save("c", 0, 1);

        assertEquals(7, projection.balance("b"));
        assertEquals(3, projection.positions.size());
        assertTrue(projection.positions.get(0) < projection.positions.get(1));
        assertTrue(projection.positions.get(1) < projection.positions.get(2));
    }

    @Test
    public void live_events_delivered_out_of_order_are_all_processed() throws Exception {
        BalanceProjection projection = projection();
        projection.start();

        CountDownLatch laterCommitDelivered = new CountDownLatch(1);
        eventStore.subscribe(EventChannels.ALL, event -> {
            if (event.getEvent().getAggregateId().equals("a")) {
                laterCommitDelivered.await(5, TimeUnit.SECONDS);
            }
        });
        AtomicReference<Throwable> writerFailure = new AtomicReference<>();
        Thread slowWriter = new Thread(() -> {
            try {
                save("a", 0, 10);
            } catch (Throwable t) {
                writerFailure.set(t);
            }
        });
        slowWriter.start();
        while (eventStore.getCurrentVersion("a", TestEvents.ACCOUNT) == 0) {
            Thread.sleep(1);
        }
        List<RecordedEvent> later = save("b", 0, 5);
        assertEquals(5, projection.balance("b"));
        laterCommitDelivered.countDown();
        slowWriter.join(5000);

        collector.checkThat(writerFailure.get(), is(nullValue()));
        collector.checkThat(projection.balance("a"), is(10));
        collector.checkThat(projection.getStats().getEventsProcessed(), is(2L));
        collector.checkThat(projection.getLastPosition(), is(later.get(0).getPosition()));
    }

    @Test
    public void failing_event_retried_in_place() throws EventStoreException {
        save("a", 0, 10);
        options.retryAttempts(3);
        BalanceProjection projection = projection();
        projection.failuresLeft = 2;
        projection.start();

        ProjectionStats stats = projection.getStats();
        collector.checkThat(projection.balance("a"), is(10));
        collector.checkThat(stats.getErrorCount(), is(2));
        collector.checkThat(stats.getLastError().get(), is("Read model unavailable"));
        collector.checkThat(stats.isRunning(), is(true));
    }

    @Test
    public void projection_stops_when_retries_exhausted() throws EventStoreException {
        save("a", 0, 10);
        options.retryAttempts(3);
        BalanceProjection projection = projection();
        projection.failuresLeft = Integer.MAX_VALUE;
        try {
            projection.start();
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals("balances", e.getProjectionName());
        }
        assertFalse(projection.isRunning());
        assertEquals(3, projection.getStats().getErrorCount());
        assertTrue(projection.getLastError().isPresent());
        assertEquals(0, projection.getLastPosition());
    }

    @Test
    public void reset_of_running_projection_replays_log() throws EventStoreException {
        save("a", 0, 10, 20);
        BalanceProjection projection = projection();
        projection.start();
        projection.reset();

        assertTrue(projection.isRunning());
        assertEquals(1, projection.resets);
        assertEquals(30, projection.balance("a"));
        assertEquals(2, projection.getStats().getEventsProcessed());
    }

    @Test
    public void reset_of_stopped_projection_drops_checkpoint() throws EventStoreException {
        save("a", 0, 10);
        BalanceProjection projection = projection();
        projection.start();
        projection.stop();
        projection.reset();

        assertFalse(projection.isRunning());
        assertFalse(checkpointStore.load("balances").isPresent());
        assertEquals(0, projection.getLastPosition());
    }

    @Test
    public void rebuild_processes_whole_log() throws EventStoreException {
        save("a", 0, 10, 20);
        BalanceProjection projection = projection();
        projection.start();
        projection.stop();
        save("a", 2, 5);

        projection.rebuild();
        assertEquals(35, projection.balance("a"));
        assertEquals(3, projection.getStats().getEventsProcessed());
        assertEquals(projection.getLastPosition(), checkpointStore.load("balances").get().getPosition());
    }

    @Test
    public void stale_events_make_projection_unhealthy() throws EventStoreException {
        Instant old = Instant.now().minus(10, ChronoUnit.MINUTES);
        eventStore.saveEvents("a", Collections.singletonList(
                TestEvents.event("a", 1, "Deposited").put("amount", 1).timestamp(old).build()), 0);
        BalanceProjection projection = projection();
        projection.start();
        assertFalse(projection.isHealthy());
        assertTrue(projection.getStats().getLag() >= 10 * 60 * 1000 - 1000);
    }

    @Test
    public void frequent_errors_make_projection_unhealthy() throws EventStoreException {
        save("a", 0, 10);
        BalanceProjection projection = projection();
        assertTrue(projection.isHealthy());
        projection.failuresLeft = 1;
        projection.start();
        assertFalse(projection.isHealthy());
    }

    @Test
    public void stats_render_as_json() throws Exception {
        save("a", 0, 10);
        BalanceProjection projection = projection();
        projection.failuresLeft = 1;
        projection.start();
        String json = JacksonSerialization.defaultMapper().writeValueAsString(projection.getStats());
        assertThat(json, containsString("\"name\":\"balances\""));
        assertThat(json, containsString("\"eventsProcessed\":1"));
        assertThat(json, containsString("\"lastError\":\"Read model unavailable\""));
        assertThat(json, containsString("\"healthy\":false"));
    }
}
