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

import io.github.goodees.escqrs.store.Snapshot;
import io.github.goodees.escqrs.store.SnapshotStore;
import io.github.goodees.escqrs.event.DomainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stores snapshots in memory. It doesn't make much sense to use it outside tests, but when aggregates don't need
 * snapshots it's good one to use.
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private static final Comparator<Snapshot> NEWEST_FIRST = Comparator.comparingLong(Snapshot::getVersion)
            .reversed();

    private final ConcurrentMap<String, List<Snapshot>> snapshots = new ConcurrentHashMap<>();

    private List<Snapshot> of(String aggregateId, String aggregateType) {
        return snapshots.computeIfAbsent(DomainEvent.streamKey(aggregateType, aggregateId),
                k -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        List<Snapshot> list = of(snapshot.getAggregateId(), snapshot.getAggregateType());
        synchronized (list) {
            list.removeIf(s -> s.getVersion() == snapshot.getVersion());
            list.add(snapshot);
            list.sort(NEWEST_FIRST);
        }
    }

    @Override
    public Optional<Snapshot> getLatestSnapshot(String aggregateId, String aggregateType) {
        List<Snapshot> list = of(aggregateId, aggregateType);
        synchronized (list) {
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
        }
    }

    @Override
    public List<Snapshot> getSnapshots(String aggregateId, String aggregateType) {
        List<Snapshot> list = of(aggregateId, aggregateType);
        synchronized (list) {
            return new ArrayList<>(list);
        }
    }

    @Override
    public int deleteOldSnapshots(String aggregateId, String aggregateType, int keepCount) {
        List<Snapshot> list = of(aggregateId, aggregateType);
        synchronized (list) {
            int removed = 0;
            while (list.size() > keepCount) {
                list.remove(list.size() - 1);
                removed++;
            }
            return removed;
        }
    }

    @Override
    public void deleteSnapshots(String aggregateId, String aggregateType) {
        snapshots.remove(DomainEvent.streamKey(aggregateType, aggregateId));
    }

    public long getSnapshottedVersion(String aggregateId, String aggregateType) {
        return getLatestSnapshot(aggregateId, aggregateType).map(Snapshot::getVersion).orElse(0L);
    }
}
