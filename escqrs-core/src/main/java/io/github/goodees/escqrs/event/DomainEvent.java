package io.github.goodees.escqrs.event;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable fact that happened to an aggregate. Events of single aggregate form a stream, totally ordered by
 * {@link #getVersion()}, that starts with 1 and has no gaps.
 *
 * <p>The version is assigned exactly once, when an aggregate raises the event. Transformations (such as schema
 * upcasting) never mutate an event, they produce a copy via {@code with*} methods.
 */
public final class DomainEvent {
    private final String id;
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final String eventType;
    private final Map<String, Object> eventData;
    private final EventMetadata metadata;
    private final Instant timestamp;

    private DomainEvent(Builder b) {
        this.id = Objects.requireNonNull(b.id, "Event id must be set");
        this.aggregateId = Objects.requireNonNull(b.aggregateId, "Aggregate id must be set");
        this.aggregateType = Objects.requireNonNull(b.aggregateType, "Aggregate type must be set");
        this.eventType = Objects.requireNonNull(b.eventType, "Event type must be set");
        if (b.version < 1) {
            throw new IllegalArgumentException("Event version must be positive, was " + b.version);
        }
        this.version = b.version;
        this.eventData = Collections.unmodifiableMap(new LinkedHashMap<>(b.eventData));
        this.metadata = b.metadata == null ? EventMetadata.builder().build() : b.metadata;
        this.timestamp = b.timestamp == null ? Instant.now() : b.timestamp;
    }

    public String getId() {
        return id;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Position of the event within its aggregate's stream.
     * @return 1-based version
     */
    public long getVersion() {
        return version;
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, Object> getEventData() {
        return eventData;
    }

    public EventMetadata getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Key of the stream this event belongs to.
     * @return stream key
     * @see #streamKey(String, String)
     */
    public String getStreamKey() {
        return streamKey(aggregateType, aggregateId);
    }

    /**
     * Schema version of the payload, as recorded in metadata.
     * @return schema version or null
     */
    public String getSchemaVersion() {
        return metadata.getVersion();
    }

    public DomainEvent withMetadata(EventMetadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }

    public DomainEvent withEventData(Map<String, Object> newData) {
        return toBuilder().eventData(newData).build();
    }

    public DomainEvent withSchemaVersion(String schemaVersion) {
        return withMetadata(metadata.withVersion(schemaVersion));
    }

    public static String streamKey(String aggregateType, String aggregateId) {
        return aggregateType + "-" + aggregateId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).aggregateId(aggregateId).aggregateType(aggregateType).version(version)
                .eventType(eventType).eventData(eventData).metadata(metadata).timestamp(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DomainEvent)) {
            return false;
        }
        DomainEvent that = (DomainEvent) o;
        return version == that.version && id.equals(that.id) && aggregateId.equals(that.aggregateId)
                && aggregateType.equals(that.aggregateType) && eventType.equals(that.eventType)
                && eventData.equals(that.eventData) && metadata.equals(that.metadata)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, aggregateId, version);
    }

    @Override
    public String toString() {
        return "DomainEvent{" + eventType + " " + getStreamKey() + "@" + version + ", id=" + id + ", data="
                + eventData + '}';
    }

    public static class Builder {
        private String id;
        private String aggregateId;
        private String aggregateType;
        private long version;
        private String eventType;
        private Map<String, Object> eventData = new LinkedHashMap<>();
        private EventMetadata metadata;
        private Instant timestamp;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder eventData(Map<String, Object> eventData) {
            this.eventData = eventData == null ? new LinkedHashMap<>() : new LinkedHashMap<>(eventData);
            return this;
        }

        public Builder put(String key, Object value) {
            this.eventData.put(key, value);
            return this;
        }

        public Builder metadata(EventMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public DomainEvent build() {
            return new DomainEvent(this);
        }
    }
}
