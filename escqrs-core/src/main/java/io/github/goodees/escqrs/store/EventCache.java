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

import io.github.goodees.escqrs.event.DomainEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read cache of complete streams, owned by single {@link EventStore}. Streams are evicted in least recently used
 * order once the cache holds more than its capacity.
 * <p>A stream is cached only in its complete form, as loaded from storage. Appends are applied only to streams
 * that are cached and whose last version directly precedes the appended events, any other situation evicts the
 * stream so that the next read reconciles with the storage.
 * <p>A stream read from storage is cached through a {@link Load}. The load is discarded when the stream was
 * appended to, invalidated or cleared while it was being read.
 */
public class EventCache {
    private final boolean enabled;
    private final Map<String, List<DomainEvent>> streams;
    private final Map<String, Load> loads = new HashMap<>();

    public EventCache(boolean enabled, int maxStreams) {
        this.enabled = enabled;
        this.streams = new LinkedHashMap<String, List<DomainEvent>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<DomainEvent>> eldest) {
                return size() > maxStreams;
            }
        };
    }

    /**
     * Cached events of a stream.
     * @return copy of cached stream, empty when it is not cached
     */
    public synchronized Optional<List<DomainEvent>> get(String streamKey) {
        List<DomainEvent> events = streams.get(streamKey);
        return events == null ? Optional.empty() : Optional.of(new ArrayList<>(events));
    }

    /**
     * Announce that a stream is about to be read from storage.
     */
    public synchronized Load startLoad(String streamKey) {
        Load load = new Load(streamKey);
        if (enabled) {
            loads.put(streamKey, load);
        }
        return load;
    }

    private synchronized void complete(Load load, List<DomainEvent> events) {
        if (loads.remove(load.streamKey, load)) {
            streams.put(load.streamKey, new ArrayList<>(events));
        }
    }

    private synchronized void abandon(Load load) {
        loads.remove(load.streamKey, load);
    }

    public synchronized void append(String streamKey, List<DomainEvent> events) {
        loads.remove(streamKey);
        List<DomainEvent> cached = streams.get(streamKey);
        if (cached == null || events.isEmpty()) {
            return;
        }
        long last = cached.isEmpty() ? 0 : cached.get(cached.size() - 1).getVersion();
        if (events.get(0).getVersion() == last + 1) {
            cached.addAll(events);
        } else {
            streams.remove(streamKey);
        }
    }

    public synchronized void invalidate(String streamKey) {
        loads.remove(streamKey);
        streams.remove(streamKey);
    }

    public synchronized void clear() {
        loads.clear();
        streams.clear();
    }

    public synchronized int size() {
        return streams.size();
    }

    /**
     * Pending read of a stream from storage.
     */
    public final class Load implements AutoCloseable {
        private final String streamKey;

        private Load(String streamKey) {
            this.streamKey = streamKey;
        }

        /**
         * Cache the stream as read, unless it changed in the meantime.
         */
        public void complete(List<DomainEvent> events) {
            EventCache.this.complete(this, events);
        }

        @Override
        public void close() {
            abandon(this);
        }
    }
}
