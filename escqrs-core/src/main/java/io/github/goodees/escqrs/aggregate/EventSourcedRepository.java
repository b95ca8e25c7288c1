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
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Repository recovering aggregates from {@link EventStore}. Recovery starts from the latest snapshot, if the
 * aggregate accepts it, and replays events that follow it.
 * <p>After save the repository takes a snapshot whenever the aggregate version crossed a multiple of
 * {@linkplain io.github.goodees.escqrs.store.EventStoreOptions#getSnapshotFrequency() snapshot frequency}. Failing
 * to take a snapshot does not fail the save.
 * @param <A> type of aggregate
 */
public class EventSourcedRepository<A extends AggregateRoot> implements AggregateRepository<A> {
    private static final Logger logger = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore eventStore;
    private final String aggregateType;
    private final AggregateFactory<A> factory;
    private final int snapshotFrequency;

    public EventSourcedRepository(EventStore eventStore, String aggregateType, AggregateFactory<A> factory) {
        this(eventStore, aggregateType, factory, eventStore.getOptions().getSnapshotFrequency());
    }

    public EventSourcedRepository(EventStore eventStore, String aggregateType, AggregateFactory<A> factory,
            int snapshotFrequency) {
        this.eventStore = eventStore;
        this.aggregateType = aggregateType;
        this.factory = factory;
        this.snapshotFrequency = snapshotFrequency;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    @Override
    public A getById(String id) throws EventStoreException {
        A aggregate = factory.create(id);
        long fromVersion = 1;
        boolean restored = false;
        Optional<Snapshot> snapshot = eventStore.getSnapshot(id, aggregateType);
        if (snapshot.isPresent()) {
            if (aggregate.restoreFromSnapshot(snapshot.get())) {
                restored = true;
                fromVersion = snapshot.get().getVersion() + 1;
            } else {
                logger.debug("{} {} did not accept snapshot at version {}, replaying full history", aggregateType,
                        id, snapshot.get().getVersion());
            }
        }
        List<DomainEvent> events = eventStore.getEvents(id, aggregateType, fromVersion);
        if (!restored && events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateType, id);
        }
        aggregate.loadFromHistory(events);
        return aggregate;
    }

    @Override
    public Optional<A> findById(String id) throws EventStoreException {
        try {
            return Optional.of(getById(id));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void save(A aggregate) throws EventStoreException {
        if (!aggregateType.equals(aggregate.getAggregateType())) {
            throw new IllegalArgumentException("Repository of " + aggregateType + " cannot save "
                    + aggregate.getAggregateType());
        }
        List<DomainEvent> uncommitted = aggregate.getUncommittedEvents();
        if (uncommitted.isEmpty()) {
            return;
        }
        long expectedVersion = aggregate.getVersion() - uncommitted.size();
        eventStore.saveEvents(aggregate.getId(), uncommitted, expectedVersion);
        aggregate.markEventsAsCommitted();
        if (shouldStoreSnapshot(expectedVersion, aggregate.getVersion())) {
            try {
                eventStore.createSnapshot(aggregate.getId(), aggregateType, aggregate.getVersion(),
                        aggregate.createSnapshot());
            } catch (EventStoreException | RuntimeException e) {
                logger.warn("Creating snapshot of {} {} at version {} failed", aggregateType, aggregate.getId(),
                        aggregate.getVersion(), e);
            }
        }
    }

    /**
     * Decide whether to take snapshot after the aggregate moved between versions.
     * @param fromVersion version before save
     * @param toVersion version after save
     * @return true if a multiple of snapshot frequency lies in (fromVersion, toVersion]
     */
    protected boolean shouldStoreSnapshot(long fromVersion, long toVersion) {
        return snapshotFrequency > 0 && toVersion / snapshotFrequency > fromVersion / snapshotFrequency;
    }

    @Override
    public boolean exists(String id) throws EventStoreException {
        return eventStore.getCurrentVersion(id, aggregateType) > 0;
    }

    @Override
    public boolean delete(String id) throws EventStoreException {
        return eventStore.deleteStream(id, aggregateType);
    }
}
