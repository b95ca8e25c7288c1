package io.github.goodees.escqrs.replay;

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
import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.event.TestEvents;
import io.github.goodees.escqrs.matching.EventHandlers;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.JacksonSerialization;
import io.github.goodees.escqrs.store.inmemory.InMemorySnapshotStore;
import io.github.goodees.escqrs.store.inmemory.InMemoryStorageRepository;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.github.goodees.escqrs.event.TestEvents.deposited;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventReplayTest {
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Rule
    public LogCapture logs = new LogCapture(EventReplay.class);

    private EventStore eventStore;
    private EventReplay replay;
    private ExecutorService worker;
    private ReplayOptions.Builder options;

    @Before
    public void setUp() {
        eventStore = new EventStore(new InMemoryStorageRepository(), new InMemorySnapshotStore(),
                new EventVersionManager(), new JacksonSerialization());
        replay = new EventReplay(eventStore, Runnable::run);
        worker = Executors.newSingleThreadExecutor();
        options = ReplayOptions.builder().delayBetweenBatches(0);
    }

    @After
    public void tearDown() {
        worker.shutdownNow();
    }

    private List<RecordedEvent> save(String account, long expectedVersion, int... amounts)
            throws EventStoreException {
        List<DomainEvent> events = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            events.add(deposited(account, expectedVersion + i + 1, amounts[i]));
        }
        return eventStore.saveEvents(account, events, expectedVersion);
    }

    private static int amount(DomainEvent event) {
        return ((Number) event.getEventData().get("amount")).intValue();
    }

    @Test
    public void filtered_replay_delivers_matching_events_in_batches() throws Exception {
        save("a", 0, 10, 20, 30);
        save("b", 0, 5);
        eventStore.saveEvents("a", Collections.singletonList(TestEvents.event("a", 4, "Renamed")
                .put("name", "savings").build()), 3);
        List<Integer> batches = new ArrayList<>();
        List<ReplayProgress> finished = new ArrayList<>();
        replay.addListener(new ReplayListener() {
            @Override
            public void batchProcessed(ReplayProgress progress, int batchSize) {
                batches.add(batchSize);
            }

            @Override
            public void replayFinished(ReplayProgress progress) {
                finished.add(progress);
            }
        });
        RecordingHandler handler = new RecordingHandler();

        String id = replay.startReplay(EventFilter.builder().aggregateIds("a").build(),
                Collections.singletonList(handler), options.batchSize(2).build());

        ReplayProgress progress = replay.getProgress(id).get();
        collector.checkThat(progress.getStatus(), is(ReplayStatus.COMPLETED));
        collector.checkThat(progress.getEstimatedTotal(), is(4L));
        collector.checkThat(progress.getProcessedEvents(), is(4L));
        collector.checkThat(progress.getFailedEvents(), is(0L));
        collector.checkThat(progress.getEndTime().isPresent(), is(true));
        collector.checkThat(handler.versions("a"), contains(1L, 2L, 3L, 4L));
        collector.checkThat(handler.versions("b").isEmpty(), is(true));
        collector.checkThat(progress.getCurrentPosition(), is(handler.events.get(3).getPosition()));
        collector.checkThat(batches, contains(2, 2));
        collector.checkThat(finished, hasSize(1));
        collector.checkThat(replay.completion(id).isDone(), is(true));
        collector.checkThat(replay.getActiveReplays().isEmpty(), is(true));
    }

    @Test
    public void skipped_event_types_are_counted_but_not_delivered() throws Exception {
        save("a", 0, 10);
        eventStore.saveEvents("a", Collections.singletonList(TestEvents.event("a", 2, "Renamed")
                .put("name", "savings").build()), 1);
        RecordingHandler handler = new RecordingHandler();

        String id = replay.startReplay(EventFilter.all(), Collections.singletonList(handler),
                options.skipEventTypes("Renamed").build());

        ReplayProgress progress = replay.getProgress(id).get();
        collector.checkThat(progress.getProcessedEvents(), is(1L));
        collector.checkThat(progress.getSkippedEvents(), is(1L));
        collector.checkThat(handler.versions("a"), contains(1L));
    }

    @Test
    public void range_of_positions_limits_replay() throws Exception {
        List<RecordedEvent> saved = save("a", 0, 1, 2, 3, 4);
        RecordingHandler handler = new RecordingHandler();

        String id = replay.startReplay(EventFilter.all(), Collections.singletonList(handler),
                options.fromPosition(saved.get(0).getPosition()).toPosition(saved.get(2).getPosition()).build());

        collector.checkThat(handler.versions("a"), contains(2L, 3L));
        collector.checkThat(replay.getProgress(id).get().getEstimatedTotal(), is(2L));
    }

    @Test
    public void new_handler_built_from_dispatch_table_receives_known_types() throws Exception {
        save("a", 0, 10, 20);
        save("b", 0, 7);
        eventStore.saveEvents("a", Collections.singletonList(TestEvents.event("a", 3, "Renamed")
                .put("name", "savings").build()), 2);
        Map<String, Integer> balances = new HashMap<>();
        List<String> unexpected = new ArrayList<>();
        EventHandlers handlers = EventHandlers.builder()
                .on("Deposited", e -> balances.merge(e.getAggregateId(), amount(e), Integer::sum))
                .otherwise(e -> unexpected.add(e.getEventType()))
                .build();

        String id = replay.replayToNewHandler(ReplayHandler.of("balances", handlers), EventFilter.all(),
                options.build());

        collector.checkThat(balances.get("a"), is(30));
        collector.checkThat(balances.get("b"), is(7));
        collector.checkThat(unexpected.isEmpty(), is(true));
        collector.checkThat(replay.getProgress(id).get().getProcessedEvents(), is(4L));
    }

    @Test
    public void aggregate_type_handler_ignores_other_types() throws Exception {
        save("a", 0, 10);
        eventStore.saveEvents("o-1", Collections.singletonList(DomainEvent.builder().id("o-1-1")
                .aggregateId("o-1").aggregateType("Order").version(1).eventType("Placed").build()), 0);
        List<String> seen = new ArrayList<>();

        replay.replayToNewHandler(ReplayHandler.forAggregateType("Order", e -> seen.add(e.getAggregateId())),
                EventFilter.all(), options.build());

        assertThat(seen, contains("o-1"));
    }

    @Test
    public void failing_event_is_recorded_and_replay_goes_on() throws Exception {
        save("a", 0, 10, 20, 30);
        RecordingHandler handler = new RecordingHandler();
        handler.failOnAmount = 20;
        List<ReplayError> reported = new ArrayList<>();
        replay.addListener(new ReplayListener() {
            @Override
            public void eventFailed(ReplayProgress progress, ReplayError error) {
                reported.add(error);
            }
        });

        String id = replay.startReplay(EventFilter.all(), Collections.singletonList(handler), options.build());

        ReplayProgress progress = replay.getProgress(id).get();
        collector.checkThat(progress.getStatus(), is(ReplayStatus.COMPLETED));
        collector.checkThat(progress.getProcessedEvents(), is(2L));
        collector.checkThat(progress.getFailedEvents(), is(1L));
        collector.checkThat(progress.getErrors(), hasSize(1));
        ReplayError error = progress.getErrors().get(0);
        collector.checkThat(error.getEventType(), is("Deposited"));
        collector.checkThat(error.getAggregateId(), is("a"));
        collector.checkThat(error.getMessage(), is("rejected amount 20"));
        collector.checkThat(reported, contains(error));
        collector.checkThat(handler.versions("a"), contains(1L, 3L));
        collector.checkThat(logs.errors(), hasSize(1));
    }

    @Test
    public void stop_on_error_fails_replay_at_first_failure() throws Exception {
        save("a", 0, 10, 20, 30);
        RecordingHandler handler = new RecordingHandler();
        handler.failOnAmount = 20;

        String id = replay.startReplay(EventFilter.all(), Collections.singletonList(handler),
                options.stopOnError(true).build());

        ReplayProgress progress = replay.completion(id).get(1, TimeUnit.SECONDS);
        collector.checkThat(progress.getStatus(), is(ReplayStatus.FAILED));
        collector.checkThat(progress.getProcessedEvents(), is(1L));
        collector.checkThat(progress.getFailedEvents(), is(1L));
        collector.checkThat(progress.getFailureReason().get(), containsString("rejected amount 20"));
        collector.checkThat(handler.versions("a"), contains(1L));
    }

    @Test
    public void paused_replay_waits_until_resumed() throws Exception {
        save("a", 0, 1, 2, 3);
        EventReplay async = new EventReplay(eventStore, worker);
        RecordingHandler handler = new RecordingHandler();
        handler.blockOnAmount = 1;

        String id = async.startReplay(EventFilter.all(), Collections.singletonList(handler),
                options.batchSize(1).build());
        assertTrue(handler.entered.await(5, TimeUnit.SECONDS));
        async.pauseReplay(id);
        assertEquals(ReplayStatus.PAUSED, async.getProgress(id).get().getStatus());
        assertThat(async.getActiveReplays(), hasSize(1));
        try {
            async.pauseReplay(id);
            fail("Paused replay cannot be paused again");
        } catch (ReplayException e) {
            assertEquals(id, e.getReplayId());
        }

        handler.release.countDown();
        for (int i = 0; i < 100 && handler.events.isEmpty(); i++) {
            TimeUnit.MILLISECONDS.sleep(10);
        }
        TimeUnit.MILLISECONDS.sleep(50);
        assertThat(handler.versions("a"), contains(1L));

        async.resumeReplay(id);
        ReplayProgress progress = async.completion(id).get(5, TimeUnit.SECONDS);
        collector.checkThat(progress.getStatus(), is(ReplayStatus.COMPLETED));
        collector.checkThat(progress.getProcessedEvents(), is(3L));
        collector.checkThat(handler.versions("a"), contains(1L, 2L, 3L));
        try {
            async.resumeReplay(id);
            fail("Completed replay cannot be resumed");
        } catch (ReplayException e) {
            collector.checkThat(e.getMessage(), containsString("COMPLETED"));
        }
    }

    @Test
    public void cancelled_replay_stops_after_current_event() throws Exception {
        save("a", 0, 1, 2, 3);
        EventReplay async = new EventReplay(eventStore, worker);
        RecordingHandler handler = new RecordingHandler();
        handler.blockOnAmount = 1;

        String id = async.startReplay(EventFilter.all(), Collections.singletonList(handler), options.build());
        assertTrue(handler.entered.await(5, TimeUnit.SECONDS));
        assertTrue(async.cancelReplay(id));
        handler.release.countDown();

        ReplayProgress progress = async.completion(id).get(5, TimeUnit.SECONDS);
        worker.shutdown();
        assertTrue(worker.awaitTermination(5, TimeUnit.SECONDS));
        collector.checkThat(progress.getStatus(), is(ReplayStatus.CANCELLED));
        collector.checkThat(progress.getEndTime().isPresent(), is(true));
        collector.checkThat(handler.versions("a"), contains(1L));
        collector.checkThat(async.cancelReplay(id), is(false));
        collector.checkThat(async.getActiveReplays().isEmpty(), is(true));
    }

    @Test
    public void only_finished_replays_can_be_removed() throws Exception {
        save("a", 0, 1);
        EventReplay async = new EventReplay(eventStore, worker);
        RecordingHandler handler = new RecordingHandler();
        handler.blockOnAmount = 1;
        String id = async.startReplay(EventFilter.all(), Collections.singletonList(handler), options.build());
        assertTrue(handler.entered.await(5, TimeUnit.SECONDS));
        try {
            async.removeReplay(id);
            fail("Running replay cannot be removed");
        } catch (ReplayException e) {
            assertThat(e.getMessage(), containsString("RUNNING"));
        }
        handler.release.countDown();
        async.completion(id).get(5, TimeUnit.SECONDS);

        async.removeReplay(id);
        assertFalse(async.getProgress(id).isPresent());
    }

    @Test
    public void unknown_replay_is_rejected() {
        try {
            replay.pauseReplay("missing");
            fail("Unknown replay cannot be paused");
        } catch (ReplayException e) {
            assertEquals("missing", e.getReplayId());
        }
        assertFalse(replay.getProgress("missing").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void replay_needs_a_handler() throws EventStoreException {
        replay.startReplay(EventFilter.all(), Collections.<ReplayHandler>emptyList(), options.build());
    }

    @Test
    public void contiguous_history_is_valid() throws EventStoreException {
        save("a", 0, 1, 2, 3);
        OrderValidation result = EventReplay.validateEventOrder(eventStore.getEvents("a", TestEvents.ACCOUNT), "a");
        assertTrue(result.isValid());
    }

    @Test
    public void gaps_and_foreign_events_are_reported() {
        OrderValidation result = EventReplay.validateEventOrder(Arrays.asList(deposited("a", 1, 1),
                deposited("b", 2, 1), deposited("a", 3, 1), deposited("a", 4, 1)), "a");
        assertFalse(result.isValid());
        assertThat(result.getIssues(), hasSize(2));
        assertThat(result.getIssues().get(0), containsString("belongs to different aggregate b"));
        assertThat(result.getIssues().get(1), is("Version gap detected: expected 2, got 3"));
    }

    @Test
    public void history_ends_at_requested_version() throws EventStoreException {
        save("a", 0, 10, 20, 30);
        List<DomainEvent> history = replay.getHistory("a", TestEvents.ACCOUNT, 2);
        assertThat(history, hasSize(2));
        assertEquals(20, amount(history.get(1)));
    }

    static class RecordingHandler implements ReplayHandler {
        final List<RecordedEvent> events = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile int failOnAmount = -1;
        volatile int blockOnAmount = -1;

        @Override
        public String getName() {
            return "recording";
        }

        @Override
        public boolean canHandle(DomainEvent event) {
            return true;
        }

        @Override
        public void handle(RecordedEvent event) throws Exception {
            if (event.getEvent().getEventType().equals("Deposited")) {
                int amount = amount(event.getEvent());
                if (amount == failOnAmount) {
                    throw new IllegalStateException("rejected amount " + amount);
                }
                if (amount == blockOnAmount) {
                    entered.countDown();
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                }
            }
            events.add(event);
        }

        List<Long> versions(String aggregateId) {
            List<Long> result = new ArrayList<>();
            synchronized (events) {
                for (RecordedEvent event : events) {
                    if (event.getEvent().getAggregateId().equals(aggregateId)) {
                        result.add(event.getEvent().getVersion());
                    }
                }
            }
            return result;
        }
    }
}
