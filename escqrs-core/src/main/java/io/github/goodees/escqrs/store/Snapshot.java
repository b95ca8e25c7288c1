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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of an aggregate at specific version. Snapshots only shorten the replay, the event log stays authoritative.
 */
public final class Snapshot {
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final Map<String, Object> data;
    private final Instant timestamp;
    private final SnapshotMetadata metadata;

    public Snapshot(String aggregateId, String aggregateType, long version, Map<String, Object> data,
            Instant timestamp, SnapshotMetadata metadata) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.aggregateType = Objects.requireNonNull(aggregateType);
        this.version = version;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.timestamp = timestamp;
        this.metadata = metadata;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Version of the aggregate captured in the snapshot.
     * @return aggregate version
     */
    public long getVersion() {
        return version;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public SnapshotMetadata getMetadata() {
        return metadata;
    }

    public String getStreamKey() {
        return DomainEvent.streamKey(aggregateType, aggregateId);
    }

    @Override
    public String toString() {
        return "Snapshot{" + getStreamKey() + "@" + version + ", " + metadata + '}';
    }
}
