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
import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only log of aggregate streams with optimistic concurrency control.
 * <p>Writes check that the stream is still at the version the writer has seen, upgrade events through
 * {@link EventVersionManager}, persist them as single batch via {@link StorageRepository} and publish them to live
 * subscribers. Reads are served from {@link EventCache} when possible and every event read is upgraded to the
 * current schema version of its type.
 * <p>Snapshots are kept in {@link SnapshotStore}; the store does not decide when to take them, that is up to the
 * {@linkplain io.github.goodees.escqrs.aggregate.EventSourcedRepository repository}.
 */
public class EventStore {
    private static final Logger logger = LoggerFactory.getLogger(EventStore.class);

    private final StorageRepository repository;
    private final SnapshotStore snapshotStore;
    private final EventVersionManager versionManager;
    private final Serialization serialization;
    private final EventStoreOptions options;
    private final Clock clock;
    private final EventCache cache;
    private final EventSubscriptions subscriptions = new EventSubscriptions();

    private final AtomicLong eventsSaved = new AtomicLong();
    private final AtomicLong eventsRead = new AtomicLong();
    private final AtomicLong snapshotsCreated = new AtomicLong();

    public EventStore(StorageRepository repository, SnapshotStore snapshotStore, EventVersionManager versionManager,
            Serialization serialization) {
        this(repository, snapshotStore, versionManager, serialization, EventStoreOptions.defaults(),
                Clock.systemUTC());
    }

    public EventStore(StorageRepository repository, SnapshotStore snapshotStore, EventVersionManager versionManager,
            Serialization serialization, EventStoreOptions options, Clock clock) {
        this.repository = repository;
        this.snapshotStore = snapshotStore;
        this.versionManager = versionManager;
        this.serialization = serialization;
        this.options = options;
        this.clock = clock;
        this.cache = new EventCache(options.isCacheEnabled(), options.getCacheMaxStreams());
    }

    public EventStoreOptions getOptions() {
        return options;
    }

    /**
     * Append events to the stream of an aggregate.
     * @param aggregateId identity of the aggregate
     * @param events events of single stream, with versions directly following {@code expectedVersion}
     * @param expectedVersion version of the stream the events were produced against
     * @return the events as recorded, with their positions
     * @throws ConcurrencyException when the stream is not at expected version; nothing is persisted
     * @throws EventStoreException when events are not a valid continuation of the stream, or storage fails
     */
    public List<RecordedEvent> saveEvents(String aggregateId, List<DomainEvent> events, long expectedVersion)
            throws EventStoreException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        String streamKey = events.get(0).getStreamKey();
        long currentVersion = repository.getCurrentVersion(streamKey);
        if (currentVersion != expectedVersion) {
            throw new ConcurrencyException(aggregateId, expectedVersion, currentVersion);
        }
        List<DomainEvent> upgraded = new ArrayList<>(events.size());
        List<StoredEvent> serialized = new ArrayList<>(events.size());
        long nextVersion = expectedVersion + 1;
        for (DomainEvent event : events) {
            if (!event.getAggregateId().equals(aggregateId) || !event.getStreamKey().equals(streamKey)) {
                throw EventStoreException.multipleStreams(streamKey, event);
            }
            if (event.getVersion() != nextVersion) {
                throw EventStoreException.nonMonotonic(streamKey, nextVersion, event);
            }
            nextVersion++;
            DomainEvent current = versionManager.upgradeEvent(event);
            upgraded.add(current);
            serialized.add(serialization.serialize(current));
        }
        List<StoredEvent> stored = repository.saveEvents(streamKey, serialized);
        cache.append(streamKey, upgraded);
        eventsSaved.addAndGet(upgraded.size());
        logger.debug("Saved {} events to {}, now at version {}", upgraded.size(), streamKey, nextVersion - 1);

        List<RecordedEvent> recorded = new ArrayList<>(upgraded.size());
        for (int i = 0; i < upgraded.size(); i++) {
            recorded.add(new RecordedEvent(stored.get(i).getPosition(), upgraded.get(i)));
        }
        recorded.forEach(subscriptions::publish);
        return recorded;
    }

    public List<DomainEvent> getEvents(String aggregateId, String aggregateType) throws EventStoreException {
        return getEvents(aggregateId, aggregateType, 0, Long.MAX_VALUE);
    }

    public List<DomainEvent> getEvents(String aggregateId, String aggregateType, long fromVersion)
            throws EventStoreException {
        return getEvents(aggregateId, aggregateType, fromVersion, Long.MAX_VALUE);
    }

    /**
     * Read events of an aggregate within version range.
     * @param aggregateId identity of the aggregate
     * @param aggregateType type of the aggregate
     * @param fromVersion lowest version, inclusive
     * @param toVersion highest version, inclusive
     * @return events in version order, in current schema versions
     * @throws EventStoreException when storage fails or events cannot be deserialized
     */
    public List<DomainEvent> getEvents(String aggregateId, String aggregateType, long fromVersion, long toVersion)
            throws EventStoreException {
        String streamKey = DomainEvent.streamKey(aggregateType, aggregateId);
        List<DomainEvent> stream = cache.get(streamKey).orElse(null);
        if (stream == null) {
            try (EventCache.Load load = cache.startLoad(streamKey)) {
                stream = loadStream(streamKey);
                load.complete(stream);
            }
        }
        List<DomainEvent> result = new ArrayList<>();
        for (DomainEvent event : stream) {
            if (event.getVersion() >= fromVersion && event.getVersion() <= toVersion) {
                result.add(event);
            }
        }
        eventsRead.addAndGet(result.size());
        return result;
    }

    private List<DomainEvent> loadStream(String streamKey) throws EventStoreException {
        List<StoredEvent> stored = repository.getEvents(streamKey, 1, Long.MAX_VALUE);
        List<DomainEvent> events = new ArrayList<>(stored.size());
        for (StoredEvent s : stored) {
            events.add(versionManager.upgradeEvent(serialization.deserialize(s)));
        }
        return events;
    }

    /**
     * Read events of all streams in order they were recorded.
     * @param filter criteria of events
     * @param fromPosition position to continue after, 0 to read from beginning
     * @param batchSize maximal number of events
     * @return matching events in position order
     * @throws EventStoreException when storage fails or events cannot be deserialized
     */
    public List<RecordedEvent> getAllEvents(EventFilter filter, long fromPosition, int batchSize)
            throws EventStoreException {
        List<StoredEvent> stored = repository.getAllEvents(filter, fromPosition, batchSize);
        List<RecordedEvent> result = new ArrayList<>(stored.size());
        for (StoredEvent s : stored) {
            result.add(new RecordedEvent(s.getPosition(), versionManager.upgradeEvent(serialization.deserialize(s))));
        }
        eventsRead.addAndGet(result.size());
        return result;
    }

    public List<RecordedEvent> getAllEvents(EventFilter filter, long fromPosition) throws EventStoreException {
        return getAllEvents(filter, fromPosition, options.getBatchSize());
    }

    public long getCurrentVersion(String aggregateId, String aggregateType) throws EventStoreException {
        return repository.getCurrentVersion(DomainEvent.streamKey(aggregateType, aggregateId));
    }

    /**
     * Create and store snapshot of an aggregate. Older snapshots beyond
     * {@link EventStoreOptions#getSnapshotsToKeep()} are removed.
     * @param aggregateId identity of the aggregate
     * @param aggregateType type of the aggregate
     * @param version aggregate version the state corresponds to
     * @param data state of the aggregate
     * @return the stored snapshot
     * @throws EventStoreException when the state cannot be serialized or stored
     */
    public Snapshot createSnapshot(String aggregateId, String aggregateType, long version, Map<String, Object> data)
            throws EventStoreException {
        String serialized = serialization.serializeState(data);
        Snapshot snapshot = new Snapshot(aggregateId, aggregateType, version, data, clock.instant(),
                SnapshotMetadata.describe(serialized, serialization.format()));
        snapshotStore.saveSnapshot(snapshot);
        int deleted = snapshotStore.deleteOldSnapshots(aggregateId, aggregateType, options.getSnapshotsToKeep());
        cache.invalidate(snapshot.getStreamKey());
        snapshotsCreated.incrementAndGet();
        logger.debug("Created {}, pruned {} older snapshots", snapshot, deleted);
        return snapshot;
    }

    /**
     * Latest snapshot of an aggregate, if it is intact. A snapshot whose checksum does not match its state is
     * ignored, which results in full replay of the stream.
     * @param aggregateId identity of the aggregate
     * @param aggregateType type of the aggregate
     * @return the snapshot, or empty when there is no usable one
     * @throws EventStoreException when storage fails
     */
    public Optional<Snapshot> getSnapshot(String aggregateId, String aggregateType) throws EventStoreException {
        Optional<Snapshot> snapshot = snapshotStore.getLatestSnapshot(aggregateId, aggregateType);
        if (snapshot.isPresent() && !isIntact(snapshot.get())) {
            logger.warn("Ignoring {}, checksum of its state does not match", snapshot.get());
            return Optional.empty();
        }
        return snapshot;
    }

    private boolean isIntact(Snapshot snapshot) throws EventStoreException {
        SnapshotMetadata metadata = snapshot.getMetadata();
        if (metadata == null || metadata.getChecksum() == null) {
            return true;
        }
        String serialized = serialization.serializeState(snapshot.getData());
        return SnapshotMetadata.describe(serialized, serialization.format()).getChecksum()
                .equals(metadata.getChecksum());
    }

    /**
     * Remove events older than given version. Current version of the stream is retained.
     * @param aggregateId identity of the aggregate
     * @param aggregateType type of the aggregate
     * @param beforeVersion events with lower version are removed
     * @return number of removed events
     * @throws EventStoreException when storage fails
     */
    public int truncateStream(String aggregateId, String aggregateType, long beforeVersion)
            throws EventStoreException {
        String streamKey = DomainEvent.streamKey(aggregateType, aggregateId);
        int removed = repository.truncateStream(streamKey, beforeVersion);
        cache.invalidate(streamKey);
        logger.info("Truncated {} events of {} before version {}", removed, streamKey, beforeVersion);
        return removed;
    }

    public boolean deleteStream(String aggregateId, String aggregateType) throws EventStoreException {
        String streamKey = DomainEvent.streamKey(aggregateType, aggregateId);
        boolean existed = repository.deleteStream(streamKey);
        snapshotStore.deleteSnapshots(aggregateId, aggregateType);
        cache.invalidate(streamKey);
        logger.info("Deleted stream {}", streamKey);
        return existed;
    }

    /**
     * Subscribe to events matching the filter.
     * @param filter criteria of events
     * @param listener receiver of events
     * @return subscription id
     */
    public String subscribe(EventFilter filter, EventListener listener) {
        return subscriptions.subscribe(filter, listener);
    }

    /**
     * Subscribe to a named channel.
     * @param channel one of {@link EventChannels} names
     * @param listener receiver of events
     * @return subscription id
     */
    public String subscribe(String channel, EventListener listener) {
        return subscriptions.subscribe(channel, listener);
    }

    public boolean unsubscribe(String subscriptionId) {
        return subscriptions.unsubscribe(subscriptionId);
    }

    public void clearCache() {
        cache.clear();
    }

    public EventStoreStats getStats() throws EventStoreException {
        return ImmutableEventStoreStats.builder().streamCount(repository.streamCount())
                .cachedStreams(cache.size()).eventsSaved(eventsSaved.get()).eventsRead(eventsRead.get())
                .snapshotsCreated(snapshotsCreated.get()).activeSubscriptions(subscriptions.size()).build();
    }
}
