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

import java.time.Instant;
import java.util.Objects;

/**
 * Serialized form of an event as handed to {@link StorageRepository}. Position is assigned by the repository when
 * the event is saved, before that it is zero.
 */
public final class StoredEvent {
    private final String eventId;
    private final String streamKey;
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final String eventType;
    private final String payload;
    private final String metadata;
    private final Instant timestamp;
    private final long position;

    public StoredEvent(String eventId, String streamKey, String aggregateId, String aggregateType, long version,
            String eventType, String payload, String metadata, Instant timestamp, long position) {
        this.eventId = Objects.requireNonNull(eventId);
        this.streamKey = Objects.requireNonNull(streamKey);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.version = version;
        this.eventType = eventType;
        this.payload = payload;
        this.metadata = metadata;
        this.timestamp = timestamp;
        this.position = position;
    }

    public StoredEvent withPosition(long newPosition) {
        return new StoredEvent(eventId, streamKey, aggregateId, aggregateType, version, eventType, payload, metadata,
                timestamp, newPosition);
    }

    public String getEventId() {
        return eventId;
    }

    public String getStreamKey() {
        return streamKey;
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

    public String getEventType() {
        return eventType;
    }

    public String getPayload() {
        return payload;
    }

    public String getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "StoredEvent{" + eventType + " " + streamKey + "@" + version + " #" + position + '}';
    }
}
