package io.github.goodees.escqrs.store;

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
import io.github.goodees.escqrs.store.inmemory.InMemorySnapshotStore;
import io.github.goodees.escqrs.store.inmemory.InMemoryStorageRepository;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import io.github.goodees.escqrs.versioning.EventVersioningBuilder;
import io.github.goodees.escqrs.versioning.VersionTransformations;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.goodees.escqrs.event.TestEvents.ACCOUNT;
import static io.github.goodees.escqrs.event.TestEvents.deposited;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventStoreTest {
    @Rule
    public ErrorCollector collector = new ErrorCollector();
    @Rule
    public LogCapture log = new LogCapture(EventStore.class);

    private CountingRepository repository;
    private InMemorySnapshotStore snapshotStore;
    private EventVersionManager versionManager;
    private EventStore store;

    @Before
    public void setUp() {
        repository = new CountingRepository();
        snapshotStore = new InMemorySnapshotStore();
        versionManager = new EventVersionManager();
        store = new EventStore(repository, snapshotStore, versionManager, new JacksonSerialization());
    }

    @Test
    public void saved_events_get_increasing_positions() throws EventStoreException {
        List<RecordedEvent> first = store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 2, 20)),
                0);
        List<RecordedEvent> second = store.saveEvents("b", Collections.singletonList(deposited("b", 1, 5)), 0);
        assertEquals(first.get(0).getPosition() + 1, first.get(1).getPosition());
        assertEquals(first.get(1).getPosition() + 1, second.get(0).getPosition());
        assertEquals(2, store.getCurrentVersion("a", ACCOUNT));
    }

    @Test
    public void stale_expected_version_is_rejected() throws EventStoreException {
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        try {
            store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
            fail("should have failed");
        } catch (ConcurrencyException e) {
            collector.checkThat(e.getAggregateId(), is("a"));
            collector.checkThat(e.getExpectedVersion(), is(0L));
            collector.checkThat(e.getActualVersion(), is(1L));
            collector.checkThat(e.getFault(), is(EventStoreException.Fault.OPTIMISTIC_LOCK));
        }
        assertEquals(1, store.getEvents("a", ACCOUNT).size());
    }

    @Test
    public void gap_in_versions_is_programmatic_error() throws EventStoreException {
        try {
            store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 3, 20)), 0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
        assertEquals(0, store.getCurrentVersion("a", ACCOUNT));
    }

    @Test
    public void events_of_other_aggregate_are_refused() {
        try {
            store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("b", 2, 20)), 0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void events_are_read_in_version_range() throws EventStoreException {
        store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 2, 20), deposited("a", 3, 30)),
                0);
        assertThat(store.getEvents("a", ACCOUNT, 2).stream().map(DomainEvent::getVersion).collect(toList()),
                contains(2L, 3L));
        assertThat(store.getEvents("a", ACCOUNT, 1, 2).stream().map(DomainEvent::getVersion).collect(toList()),
                contains(1L, 2L));
        assertTrue(store.getEvents("unknown", ACCOUNT).isEmpty());
    }

    @Test
    public void cached_stream_is_not_read_again() throws EventStoreException {
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        store.getEvents("a", ACCOUNT);
        store.saveEvents("a", Collections.singletonList(deposited("a", 2, 10)), 1);
        assertThat(store.getEvents("a", ACCOUNT), hasSize(2));
        assertEquals(1, repository.streamReads.get());

        store.clearCache();
        store.getEvents("a", ACCOUNT);
        assertEquals(2, repository.streamReads.get());
    }

    @Test
    public void disabled_cache_reads_storage_every_time() throws EventStoreException {
        store = new EventStore(repository, snapshotStore, versionManager, new JacksonSerialization(),
                EventStoreOptions.builder().cacheEnabled(false).build(), java.time.Clock.systemUTC());
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        store.getEvents("a", ACCOUNT);
        store.getEvents("a", ACCOUNT);
        assertEquals(2, repository.streamReads.get());
        assertEquals(0, store.getStats().getCachedStreams());
    }

    @Test
    public void events_are_upgraded_on_save_and_read() throws EventStoreException {
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        versionManager.registerVersioning(EventVersioningBuilder.forEventType("Deposited").currentVersion("2.0")
                .upcast("1.0", "2.0", VersionTransformations.addField("currency", "EUR")).build());
        store.clearCache();
        DomainEvent read = store.getEvents("a", ACCOUNT).get(0);
        assertEquals("2.0", read.getSchemaVersion());
        assertEquals("EUR", read.getEventData().get("currency"));

        RecordedEvent saved = store.saveEvents("a", Collections.singletonList(deposited("a", 2, 10)), 1).get(0);
        assertEquals("2.0", saved.getEvent().getSchemaVersion());
    }

    @Test
    public void all_events_are_read_after_position() throws EventStoreException {
        store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 2, 20)), 0);
        store.saveEvents("b", Collections.singletonList(TestEvents.event("b", 1, "Opened").build()), 0);
        List<RecordedEvent> all = store.getAllEvents(EventFilter.all(), 0);
        assertThat(all, hasSize(3));
        List<RecordedEvent> after = store.getAllEvents(EventFilter.all(), all.get(0).getPosition());
        assertThat(after, hasSize(2));
        List<RecordedEvent> opened = store.getAllEvents(EventFilter.builder().eventTypes("Opened").build(), 0);
        assertThat(opened.stream().map(e -> e.getEvent().getAggregateId()).collect(toList()), contains("b"));
        assertThat(store.getAllEvents(EventFilter.all(), 0, 1), hasSize(1));
    }

    @Test
    public void subscribers_receive_committed_events_on_channels() throws EventStoreException {
        List<String> received = new ArrayList<>();
        store.subscribe(EventChannels.ALL, e -> received.add("all:" + e.getEvent().getVersion()));
        store.subscribe(EventChannels.eventType("Deposited"), e -> received.add("type:" + e.getEvent().getVersion()));
        store.subscribe(EventChannels.aggregateType(ACCOUNT), e -> received.add("agg:" + e.getEvent().getVersion()));
        String filtered = store.subscribe(EventFilter.builder().aggregateIds("a").build(),
                e -> received.add("filter:" + e.getEvent().getVersion()));

        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        store.saveEvents("b", Collections.singletonList(deposited("b", 1, 10)), 0);
        assertThat(received, contains("all:1", "type:1", "agg:1", "filter:1", "all:1", "type:1", "agg:1"));

        assertTrue(store.unsubscribe(filtered));
        assertFalse(store.unsubscribe(filtered));
        assertEquals(3, store.getStats().getActiveSubscriptions());
    }

    @Test
    public void failing_subscriber_does_not_break_others() throws EventStoreException {
        List<Long> received = new ArrayList<>();
        store.subscribe(EventChannels.ALL, e -> {
            throw new IllegalStateException("listener failed");
        });
        store.subscribe(EventChannels.ALL, e -> received.add(e.getPosition()));
        List<RecordedEvent> saved = store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        assertThat(received, contains(saved.get(0).getPosition()));
    }

    @Test
    public void snapshots_are_pruned_to_configured_count() throws EventStoreException {
        for (int version = 50; version <= 350; version += 50) {
            store.createSnapshot("a", ACCOUNT, version, Collections.singletonMap("balance", version));
        }
        assertEquals(EventStoreOptions.DEFAULT_SNAPSHOTS_TO_KEEP, snapshotStore.getSnapshots("a", ACCOUNT).size());
        assertEquals(350, store.getSnapshot("a", ACCOUNT).get().getVersion());
        assertEquals(7, store.getStats().getSnapshotsCreated());
    }

    @Test
    public void snapshot_with_wrong_checksum_is_ignored() throws EventStoreException {
        Map<String, Object> state = Collections.singletonMap("balance", 100);
        snapshotStore.saveSnapshot(new Snapshot("a", ACCOUNT, 10, state, Instant.now(),
                new SnapshotMetadata("0000", 13, SnapshotMetadata.NO_COMPRESSION, "json")));
        Optional<Snapshot> snapshot = store.getSnapshot("a", ACCOUNT);
        assertFalse(snapshot.isPresent());
        assertThat(log.warnings(), hasItem(startsWith("Ignoring Snapshot{")));
    }

    @Test
    public void truncation_keeps_current_version() throws EventStoreException {
        store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 2, 20), deposited("a", 3, 30)),
                0);
        assertEquals(2, store.truncateStream("a", ACCOUNT, 3));
        assertEquals(3, store.getCurrentVersion("a", ACCOUNT));
        assertThat(store.getEvents("a", ACCOUNT), hasSize(1));
    }

    @Test
    public void deleted_stream_loses_snapshots() throws EventStoreException {
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        store.createSnapshot("a", ACCOUNT, 1, Collections.singletonMap("balance", 10));
        assertTrue(store.deleteStream("a", ACCOUNT));
        assertEquals(0, store.getCurrentVersion("a", ACCOUNT));
        assertFalse(store.getSnapshot("a", ACCOUNT).isPresent());
        assertTrue(store.getEvents("a", ACCOUNT).isEmpty());
    }

    @Test
    public void stats_count_streams_and_events() throws EventStoreException {
        store.saveEvents("a", Arrays.asList(deposited("a", 1, 10), deposited("a", 2, 20)), 0);
        store.saveEvents("b", Collections.singletonList(deposited("b", 1, 10)), 0);
        store.getEvents("a", ACCOUNT);
        EventStoreStats stats = store.getStats();
        collector.checkThat(stats.getStreamCount(), is(2L));
        collector.checkThat(stats.getEventsSaved(), is(3L));
        collector.checkThat(stats.getEventsRead(), is(2L));
        collector.checkThat(stats.getCachedStreams(), is(1));
    }

    @Test
    public void stream_read_concurrently_with_appends() throws Exception {
        List<DomainEvent> initial = new ArrayList<>();
        for (int v = 1; v <= 500; v++) {
            initial.add(deposited("a", v, 1));
        }
        store.saveEvents("a", initial, 0);
        store.getEvents("a", ACCOUNT);

        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicReference<Throwable> readFailure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            try {
                while (writing.get()) {
                    List<DomainEvent> events = store.getEvents("a", ACCOUNT);
                    for (int i = 0; i < events.size(); i++) {
                        assertEquals(i + 1, events.get(i).getVersion());
                    }
                }
            } catch (Throwable t) {
                readFailure.set(t);
            }
        });
        reader.start();
        try {
            for (int v = 501; v <= 1000; v++) {
                store.saveEvents("a", Collections.singletonList(deposited("a", v, 1)), v - 1);
            }
        } finally {
            writing.set(false);
            reader.join(10000);
        }
        assertNull(readFailure.get());
        assertThat(store.getEvents("a", ACCOUNT), hasSize(1000));
    }

    @Test
    public void stream_loaded_during_append_is_not_cached_stale() throws EventStoreException {
        store.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
        repository.afterStreamRead = () -> {
            repository.afterStreamRead = null;
            try {
                store.saveEvents("a", Collections.singletonList(deposited("a", 2, 20)), 1);
            } catch (EventStoreException e) {
                throw new IllegalStateException(e);
            }
        };
        assertThat(store.getEvents("a", ACCOUNT), hasSize(1));
        assertThat(store.getEvents("a", ACCOUNT), hasSize(2));
        assertEquals(2, repository.streamReads.get());
        assertThat(store.getEvents("a", ACCOUNT), hasSize(2));
        assertEquals(2, repository.streamReads.get());
    }

    static class CountingRepository extends InMemoryStorageRepository {
        final AtomicInteger streamReads = new AtomicInteger();
        volatile Runnable afterStreamRead;

        @Override
        public List<StoredEvent> getEvents(String streamKey, long fromVersion, long toVersion) {
            streamReads.incrementAndGet();
            List<StoredEvent> events = super.getEvents(streamKey, fromVersion, toVersion);
            Runnable hook = afterStreamRead;
            if (hook != null) {
                hook.run();
            }
            return events;
        }
    }
}
