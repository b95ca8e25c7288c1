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

import java.util.List;
import java.util.Optional;

/**
 * Storage of aggregate snapshots. Multiple snapshots of an aggregate may be kept, the most recent one is used for
 * recovery.
 */
public interface SnapshotStore {

    void saveSnapshot(Snapshot snapshot) throws EventStoreException;

    Optional<Snapshot> getLatestSnapshot(String aggregateId, String aggregateType) throws EventStoreException;

    /**
     * All snapshots of an aggregate.
     * @param aggregateId aggregate identity
     * @param aggregateType aggregate type
     * @return snapshots, newest (highest version) first
     * @throws EventStoreException on storage failure
     */
    List<Snapshot> getSnapshots(String aggregateId, String aggregateType) throws EventStoreException;

    /**
     * Keep only given number of most recent snapshots.
     * @param aggregateId aggregate identity
     * @param aggregateType aggregate type
     * @param keepCount number of snapshots to keep
     * @return number of deleted snapshots
     * @throws EventStoreException on storage failure
     */
    int deleteOldSnapshots(String aggregateId, String aggregateType, int keepCount) throws EventStoreException;

    void deleteSnapshots(String aggregateId, String aggregateType) throws EventStoreException;
}
