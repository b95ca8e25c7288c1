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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata attached to every {@link DomainEvent}. Besides the schema version of the payload it carries the tracing
 * information (correlation and causation), that allows sagas to route events back to the process that caused them.
 */
public final class EventMetadata {
    public static final String DEFAULT_SCHEMA_VERSION = "1.0";
    public static final String DEFAULT_CONTENT_TYPE = "application/json";
    public static final String DEFAULT_SERIALIZATION = "json";

    private static final String VERSION = "version";
    private static final String CORRELATION_ID = "correlationId";
    private static final String CAUSATION_ID = "causationId";
    private static final String USER_ID = "userId";
    private static final String SOURCE = "source";
    private static final String CONTENT_TYPE = "contentType";
    private static final String SERIALIZATION = "serialization";

    private final String version;
    private final String correlationId;
    private final String causationId;
    private final String userId;
    private final String source;
    private final String contentType;
    private final String serialization;
    private final Map<String, Object> additional;

    private EventMetadata(Builder b) {
        this.version = b.version;
        this.correlationId = b.correlationId;
        this.causationId = b.causationId;
        this.userId = b.userId;
        this.source = b.source;
        this.contentType = b.contentType;
        this.serialization = b.serialization;
        this.additional = Collections.unmodifiableMap(new LinkedHashMap<>(b.additional));
    }

    /**
     * Schema version of event payload, in dot notation.
     * @return schema version, null when not known
     */
    public String getVersion() {
        return version;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getCausationId() {
        return causationId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSource() {
        return source;
    }

    public String getContentType() {
        return contentType;
    }

    public String getSerialization() {
        return serialization;
    }

    public Map<String, Object> getAdditional() {
        return additional;
    }

    public EventMetadata withVersion(String newVersion) {
        return toBuilder().version(newVersion).build();
    }

    /**
     * Combine this metadata with overrides. Every value set in overrides replaces the value of this instance.
     * @param overrides metadata with precedence, may be null
     * @return merged metadata
     */
    public EventMetadata merge(EventMetadata overrides) {
        if (overrides == null) {
            return this;
        }
        Builder b = toBuilder();
        if (overrides.version != null) {
            b.version(overrides.version);
        }
        if (overrides.correlationId != null) {
            b.correlationId(overrides.correlationId);
        }
        if (overrides.causationId != null) {
            b.causationId(overrides.causationId);
        }
        if (overrides.userId != null) {
            b.userId(overrides.userId);
        }
        if (overrides.source != null) {
            b.source(overrides.source);
        }
        if (overrides.contentType != null) {
            b.contentType(overrides.contentType);
        }
        if (overrides.serialization != null) {
            b.serialization(overrides.serialization);
        }
        b.additional.putAll(overrides.additional);
        return b.build();
    }

    /**
     * Flat representation used for serialization.
     * @return map of all non-null values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(additional);
        putIfPresent(result, VERSION, version);
        putIfPresent(result, CORRELATION_ID, correlationId);
        putIfPresent(result, CAUSATION_ID, causationId);
        putIfPresent(result, USER_ID, userId);
        putIfPresent(result, SOURCE, source);
        putIfPresent(result, CONTENT_TYPE, contentType);
        putIfPresent(result, SERIALIZATION, serialization);
        return result;
    }

    public static EventMetadata fromMap(Map<String, Object> map) {
        Map<String, Object> rest = new LinkedHashMap<>(map);
        Builder b = builder();
        b.version = asString(rest.remove(VERSION));
        b.correlationId = asString(rest.remove(CORRELATION_ID));
        b.causationId = asString(rest.remove(CAUSATION_ID));
        b.userId = asString(rest.remove(USER_ID));
        b.source = asString(rest.remove(SOURCE));
        b.contentType = asString(rest.remove(CONTENT_TYPE));
        b.serialization = asString(rest.remove(SERIALIZATION));
        b.additional.putAll(rest);
        return b.build();
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String asString(Object o) {
        return o == null ? null : o.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.version = version;
        b.correlationId = correlationId;
        b.causationId = causationId;
        b.userId = userId;
        b.source = source;
        b.contentType = contentType;
        b.serialization = serialization;
        b.additional.putAll(additional);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventMetadata)) {
            return false;
        }
        EventMetadata that = (EventMetadata) o;
        return toMap().equals(that.toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, correlationId, causationId, userId, source);
    }

    @Override
    public String toString() {
        return "EventMetadata" + toMap();
    }

    public static class Builder {
        private String version;
        private String correlationId;
        private String causationId;
        private String userId;
        private String source;
        private String contentType;
        private String serialization;
        private final Map<String, Object> additional = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder serialization(String serialization) {
            this.serialization = serialization;
            return this;
        }

        public Builder put(String key, Object value) {
            this.additional.put(key, value);
            return this;
        }

        public EventMetadata build() {
            return new EventMetadata(this);
        }
    }
}
