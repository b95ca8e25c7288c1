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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Common logic of snapshot stores that keep state in serialized form. Subclasses only move {@link SnapshotRecord}s
 * in and out of their storage.
 */
public abstract class SnapshotStoreWithSerialization implements SnapshotStore {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final Serialization serialization;

    protected SnapshotStoreWithSerialization(Serialization serialization) {
        this.serialization = serialization;
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) throws EventStoreException {
        String payload = serialization.serializeState(snapshot.getData());
        SnapshotMetadata metadata = snapshot.getMetadata() != null ? snapshot.getMetadata()
                : SnapshotMetadata.describe(payload, serialization.format());
        storeSnapshotRecord(new SnapshotRecord(snapshot.getAggregateId(), snapshot.getAggregateType(),
                snapshot.getVersion(), snapshot.getTimestamp(), metadata, payload));
    }

    @Override
    public Optional<Snapshot> getLatestSnapshot(String aggregateId, String aggregateType)
            throws EventStoreException {
        SnapshotRecord record = retrieveLatestSnapshotRecord(aggregateId, aggregateType);
        if (record == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(record));
        } catch (EventStoreException e) {
            logger.error("Failure during deserialization of snapshot of {}-{} at version {}", aggregateType,
                    aggregateId, record.version, e);
            return Optional.empty();
        }
    }

    @Override
    public List<Snapshot> getSnapshots(String aggregateId, String aggregateType) throws EventStoreException {
        List<Snapshot> result = new ArrayList<>();
        for (SnapshotRecord record : retrieveSnapshotRecords(aggregateId, aggregateType)) {
            result.add(deserialize(record));
        }
        return result;
    }

    private Snapshot deserialize(SnapshotRecord record) throws EventStoreException {
        Map<String, Object> data = serialization.deserializeState(record.payload);
        return new Snapshot(record.aggregateId, record.aggregateType, record.version, data, record.timestamp,
                record.metadata);
    }

    /**
     * Retrieve most recent snapshot of an aggregate.
     * @param aggregateId aggregate identity
     * @param aggregateType aggregate type
     * @return the record or null if there is none
     * @throws EventStoreException on storage failure
     */
    protected abstract SnapshotRecord retrieveLatestSnapshotRecord(String aggregateId, String aggregateType)
            throws EventStoreException;

    /**
     * Retrieve all snapshots of an aggregate, newest first.
     * @param aggregateId aggregate identity
     * @param aggregateType aggregate type
     * @return the records
     * @throws EventStoreException on storage failure
     */
    protected abstract List<SnapshotRecord> retrieveSnapshotRecords(String aggregateId, String aggregateType)
            throws EventStoreException;

    /**
     * Actually commit the snapshot record into underlying storage.
     * @param snapshotRecord the record to store
     * @throws EventStoreException on storage failure
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord) throws EventStoreException;

    /**
     * The record about a snapshot.
     */
    protected static class SnapshotRecord {
        protected final String aggregateId;
        protected final String aggregateType;
        protected final long version;
        protected final Instant timestamp;
        protected final SnapshotMetadata metadata;
        protected final String payload;

        public SnapshotRecord(String aggregateId, String aggregateType, long version, Instant timestamp,
                SnapshotMetadata metadata, String payload) {
            this.aggregateId = aggregateId;
            this.aggregateType = aggregateType;
            this.version = version;
            this.timestamp = timestamp;
            this.metadata = metadata;
            this.payload = payload;
        }

        public String getAggregateId() {
            return aggregateId;
        }

        public String getAggregateType() {
            return aggregateType;
        }

        public long getVersion() {
            return version;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public SnapshotMetadata getMetadata() {
            return metadata;
        }

        public String getPayload() {
            return payload;
        }
    }
}
