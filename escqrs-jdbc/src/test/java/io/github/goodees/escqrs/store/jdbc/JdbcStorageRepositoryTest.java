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
import io.github.goodees.escqrs.store.ConcurrencyException;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.StoredEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class JdbcStorageRepositoryTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageRepositoryTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Test
    public void events_for_new_stream_are_persisted() throws EventStoreException {
        List<StoredEvent> saved = repository.saveEvents(streamKey(),
                Arrays.asList(event(1, "Deposited", 100), event(2, "Deposited", 200)));
        assertDb(2, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
        assertDb(2, "select STREAM_VERSION from ES_STREAM where STREAM_KEY = ?", streamKey());
        assertEquals(2, repository.getCurrentVersion(streamKey()));
        assertThat(saved.get(0).getPosition(), greaterThan(0L));
        assertEquals(saved.get(0).getPosition() + 1, saved.get(1).getPosition());
    }

    @Test
    public void events_for_existing_stream_are_persisted() throws EventStoreException {
        repository.saveEvents(streamKey(), Arrays.asList(event(1, "Deposited", 100), event(2, "Deposited", 200)));
        repository.saveEvents(streamKey(), Arrays.asList(event(3, "Withdrawn", 100), event(4, "Deposited", 50)));
        assertDb(4, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
        assertDb(4, "select STREAM_VERSION from ES_STREAM where STREAM_KEY = ?", streamKey());
    }

    @Test
    public void events_are_read_in_version_range() throws EventStoreException {
        StoredEvent first = event(1, "Deposited", 100);
        repository.saveEvents(streamKey(), Arrays.asList(first, event(2, "Withdrawn", 20), event(3, "Deposited", 5)));
        List<StoredEvent> read = repository.getEvents(streamKey(), 2, 3);
        assertThat(read.stream().map(StoredEvent::getVersion).collect(toList()), contains(2L, 3L));

        StoredEvent readFirst = repository.getEvents(streamKey(), 1, 1).get(0);
        collector.checkThat(readFirst.getEventId(), is(first.getEventId()));
        collector.checkThat(readFirst.getAggregateId(), is(name()));
        collector.checkThat(readFirst.getAggregateType(), is(AGGREGATE_TYPE));
        collector.checkThat(readFirst.getEventType(), is("Deposited"));
        collector.checkThat(readFirst.getPayload(), is(first.getPayload()));
        collector.checkThat(readFirst.getMetadata(), is(first.getMetadata()));
        collector.checkThat(readFirst.getTimestamp(), is(first.getTimestamp()));
    }

    @Test
    public void unknown_stream_has_no_events() throws EventStoreException {
        assertEquals(0, repository.getCurrentVersion(streamKey()));
        assertTrue(repository.getEvents(streamKey(), 1, Long.MAX_VALUE).isEmpty());
    }

    @Test
    public void mixing_streams_fails() {
        try {
            repository.saveEvents(streamKey(), Arrays.asList(event(1, "Deposited", 100),
                    event(name() + "!", 2, "Deposited", 200)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from ES_EVENT where AGGREGATE_ID like 'mixing%'");
        }
    }

    @Test
    public void skipping_versions_fails() {
        try {
            repository.saveEvents(streamKey(), Arrays.asList(event(1, "Deposited", 100), event(3, "Deposited", 200)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
        }
    }

    @Test
    public void persisting_stale_events_throws_early() {
        try {
            template.update("insert into ES_STREAM (STREAM_KEY, STREAM_VERSION) values(?, 10)", streamKey());
            repository.saveEvents(streamKey(), Arrays.asList(event(10, "Deposited", 100),
                    event(11, "Deposited", 200)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertThat(e, instanceOf(ConcurrencyException.class));
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            assertEquals(10, ((ConcurrencyException) e).getActualVersion());
            assertDb(0, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
            assertDb(10, "select STREAM_VERSION from ES_STREAM where STREAM_KEY = ?", streamKey());
        }
    }

    @Test
    public void gap_after_new_stream_is_concurrency_conflict() {
        try {
            repository.saveEvents(streamKey(), Arrays.asList(event(3, "Deposited", 100)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertThat(e, instanceOf(ConcurrencyException.class));
            assertEquals(0, ((ConcurrencyException) e).getActualVersion());
            assertDb(0, "select count(*) from ES_STREAM where STREAM_KEY = ?", streamKey());
        }
    }

    @Test
    public void concurrent_writers_one_loses_with_concurrency_exception() throws Exception {
        repository.saveEvents(streamKey(), Arrays.asList(event(1, "Opened", 0)));

        // both writers read the stream version before either of them writes
        CyclicBarrier bothRead = new CyclicBarrier(2);
        AtomicInteger reads = new AtomicInteger();
        DefaultJdbcSchema racing = new DefaultJdbcSchema() {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                long version = super.readStreamVersion(rs);
                if (reads.getAndIncrement() < 2) {
                    try {
                        logger.info("Writer read version {}, waiting for the other one", version);
                        bothRead.await(5, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        collector.addError(e);
                    }
                }
                return version;
            }
        };
        JdbcStorageRepository racingRepository = new JdbcStorageRepository(ds, racing);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<List<StoredEvent>>> writers = new ArrayList<>();
            writers.add(executor.submit(() -> racingRepository.saveEvents(streamKey(),
                    Arrays.asList(event(2, "Deposited", 10)))));
            writers.add(executor.submit(() -> racingRepository.saveEvents(streamKey(),
                    Arrays.asList(event(2, "Deposited", 20)))));

            int succeeded = 0;
            int conflicts = 0;
            for (Future<List<StoredEvent>> writer : writers) {
                try {
                    writer.get(20, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    logger.info("Writer failed", e.getCause());
                    collector.checkThat(e.getCause(), instanceOf(ConcurrencyException.class));
                    conflicts++;
                }
            }
            assertEquals(1, succeeded);
            assertEquals(1, conflicts);
        } finally {
            executor.shutdownNow();
        }
        assertDb(2, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
        assertDb(2, "select STREAM_VERSION from ES_STREAM where STREAM_KEY = ?", streamKey());
    }

    @Test
    public void all_events_are_read_in_position_order_with_filter() throws EventStoreException {
        String other = name() + "-other";
        List<StoredEvent> first = repository.saveEvents(streamKey(), Arrays.asList(event(1, "Opened", 0)));
        long start = first.get(0).getPosition() - 1;
        repository.saveEvents(otherStreamKey(other), Arrays.asList(event(other, 1, "Opened", 0)));
        repository.saveEvents(streamKey(), Arrays.asList(event(2, "Deposited", 10), event(3, "Deposited", 20)));

        List<StoredEvent> all = repository.getAllEvents(EventFilter.builder().aggregateIds(name(), other).build(),
                start, 100);
        assertThat(all.stream().map(StoredEvent::getEventType).collect(toList()),
                contains("Opened", "Opened", "Deposited", "Deposited"));

        List<StoredEvent> deposits = repository.getAllEvents(EventFilter.builder().aggregateIds(name(), other)
                .eventTypes("Deposited").build(), start, 100);
        assertThat(deposits.stream().map(StoredEvent::getVersion).collect(toList()), contains(2L, 3L));

        List<StoredEvent> batch = repository.getAllEvents(EventFilter.builder().aggregateIds(name(), other).build(),
                start, 2);
        assertEquals(2, batch.size());
        List<StoredEvent> next = repository.getAllEvents(EventFilter.builder().aggregateIds(name(), other).build(),
                batch.get(1).getPosition(), 2);
        assertThat(next.stream().map(StoredEvent::getVersion).collect(toList()), contains(2L, 3L));
        assertThat(next.stream().map(StoredEvent::getPosition).collect(toList()),
                everyItem(greaterThan(batch.get(1).getPosition())));
    }

    private static String otherStreamKey(String aggregateId) {
        return DomainEvent.streamKey(AGGREGATE_TYPE, aggregateId);
    }

    @Test
    public void truncate_keeps_stream_version() throws EventStoreException {
        repository.saveEvents(streamKey(), Arrays.asList(event(1, "Opened", 0), event(2, "Deposited", 10),
                event(3, "Deposited", 20)));
        assertEquals(2, repository.truncateStream(streamKey(), 3));
        assertEquals(3, repository.getCurrentVersion(streamKey()));
        assertThat(repository.getEvents(streamKey(), 1, 3).stream().map(StoredEvent::getVersion).collect(toList()),
                contains(3L));
    }

    @Test
    public void deleted_stream_is_gone() throws EventStoreException {
        repository.saveEvents(streamKey(), Arrays.asList(event(1, "Opened", 0)));
        long streams = repository.streamCount();
        assertTrue(repository.deleteStream(streamKey()));
        assertFalse(repository.deleteStream(streamKey()));
        assertEquals(0, repository.getCurrentVersion(streamKey()));
        assertEquals(streams - 1, repository.streamCount());
        assertDb(0, "select count(*) from ES_EVENT where STREAM_KEY = ?", streamKey());
    }
}
