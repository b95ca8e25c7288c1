package io.github.goodees.escqrs.store.inmemory;

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

import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.store.ConcurrencyException;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.StorageRepository;
import io.github.goodees.escqrs.store.StoredEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.stream.Collectors.toList;

/**
 * Keeps streams in memory. Suitable for tests and for single process deployments that can afford to lose events on
 * restart.
 */
public class InMemoryStorageRepository implements StorageRepository {
    private final ConcurrentMap<String, Stream> storage = new ConcurrentHashMap<>();
    private final TreeMap<Long, StoredEvent> log = new TreeMap<>();
    private long lastPosition;

    private Stream stream(String streamKey) {
        return storage.computeIfAbsent(streamKey, k -> new Stream());
    }

    @Override
    public List<StoredEvent> saveEvents(String streamKey, List<StoredEvent> events) throws EventStoreException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        Stream stream = stream(streamKey);
        synchronized (stream) {
            long expected = events.get(0).getVersion() - 1;
            if (stream.version != expected) {
                throw new ConcurrencyException(events.get(0).getAggregateId(), expected, stream.version);
            }
            List<StoredEvent> saved = new ArrayList<>(events.size());
            synchronized (log) {
                for (StoredEvent event : events) {
                    StoredEvent positioned = event.withPosition(++lastPosition);
                    log.put(positioned.getPosition(), positioned);
                    saved.add(positioned);
                }
            }
            stream.events.addAll(saved);
            stream.version = saved.get(saved.size() - 1).getVersion();
            return saved;
        }
    }

    @Override
    public List<StoredEvent> getEvents(String streamKey, long fromVersion, long toVersion) {
        Stream stream = storage.get(streamKey);
        if (stream == null) {
            return Collections.emptyList();
        }
        synchronized (stream) {
            return stream.events.stream().filter(e -> e.getVersion() >= fromVersion && e.getVersion() <= toVersion)
                    .collect(toList());
        }
    }

    @Override
    public long getCurrentVersion(String streamKey) {
        Stream stream = storage.get(streamKey);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            return stream.version;
        }
    }

    @Override
    public List<StoredEvent> getAllEvents(EventFilter filter, long fromPosition, int batchSize) {
        List<StoredEvent> result = new ArrayList<>();
        synchronized (log) {
            for (StoredEvent event : log.tailMap(fromPosition, false).values()) {
                if (result.size() >= batchSize) {
                    break;
                }
                if (matches(filter, event)) {
                    result.add(event);
                }
            }
        }
        return result;
    }

    /**
     * Filtering happens on envelope data, as the stored payload is opaque to the storage.
     */
    static boolean matches(EventFilter filter, StoredEvent event) {
        if (!filter.getEventTypes().isEmpty() && !filter.getEventTypes().contains(event.getEventType())) {
            return false;
        }
        if (!filter.getAggregateTypes().isEmpty() && !filter.getAggregateTypes().contains(event.getAggregateType())) {
            return false;
        }
        if (!filter.getAggregateIds().isEmpty() && !filter.getAggregateIds().contains(event.getAggregateId())) {
            return false;
        }
        Instant ts = event.getTimestamp();
        if (filter.getFrom() != null && ts.isBefore(filter.getFrom())) {
            return false;
        }
        return filter.getTo() == null || !ts.isAfter(filter.getTo());
    }

    @Override
    public int truncateStream(String streamKey, long beforeVersion) {
        Stream stream = storage.get(streamKey);
        if (stream == null) {
            return 0;
        }
        synchronized (stream) {
            List<StoredEvent> removed = stream.events.stream().filter(e -> e.getVersion() < beforeVersion)
                    .collect(toList());
            stream.events.removeAll(removed);
            synchronized (log) {
                removed.forEach(e -> log.remove(e.getPosition()));
            }
            return removed.size();
        }
    }

    @Override
    public boolean deleteStream(String streamKey) {
        Stream stream = storage.remove(streamKey);
        if (stream == null) {
            return false;
        }
        synchronized (stream) {
            synchronized (log) {
                stream.events.forEach(e -> log.remove(e.getPosition()));
            }
            return true;
        }
    }

    @Override
    public long streamCount() {
        return storage.values().stream().filter(s -> s.version > 0).count();
    }

    /**
     * Snapshot of all streams, for assertions in tests.
     * @return copy of stored events per stream
     */
    public Map<String, List<StoredEvent>> dump() {
        Map<String, List<StoredEvent>> result = new TreeMap<>();
        storage.forEach((key, stream) -> {
            synchronized (stream) {
                result.put(key, new ArrayList<>(stream.events));
            }
        });
        return result;
    }

    private static class Stream {
        private final List<StoredEvent> events = new ArrayList<>();
        private long version;
    }
}
