package io.github.goodees.escqrs.bus;

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
import java.util.UUID;

/**
 * Request to read state. Handled by exactly one {@link QueryHandler}, results may be cached.
 */
public final class Query implements Message {
    public static final String DEFAULT_SOURCE = "application";

    private final String id;
    private final String queryType;
    private final Map<String, Object> parameters;
    private final QueryMetadata metadata;
    private final Instant timestamp;

    private Query(Builder b) {
        this.id = b.id;
        this.queryType = b.queryType;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.metadata = b.metadata.build();
        this.timestamp = b.timestamp;
    }

    /**
     * Start a query with fresh id and current timestamp.
     * @param queryType type of query
     * @return builder
     */
    public static Builder builder(String queryType) {
        return new Builder().id(UUID.randomUUID().toString()).queryType(queryType)
                .correlationId(UUID.randomUUID().toString()).source(DEFAULT_SOURCE).timestamp(Instant.now());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).queryType(queryType).parameters(parameters).metadata(metadata)
                .timestamp(timestamp);
    }

    @Override
    public String getId() {
        return id;
    }

    public String getQueryType() {
        return queryType;
    }

    @Override
    public String getMessageType() {
        return queryType;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public QueryMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String getCorrelationId() {
        return metadata.getCorrelationId();
    }

    @Override
    public String getUserId() {
        return metadata.getUserId();
    }

    @Override
    public String getSource() {
        return metadata.getSource();
    }

    @Override
    public Long getTimeout() {
        return metadata.getTimeout();
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Query{" + queryType + parameters + ", id=" + id + '}';
    }

    public static class Builder {
        private String id;
        private String queryType;
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private QueryMetadata.Builder metadata = QueryMetadata.builder();
        private Instant timestamp;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder queryType(String queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder metadata(QueryMetadata metadata) {
            this.metadata = metadata.toBuilder();
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.metadata.correlationId(correlationId);
            return this;
        }

        public Builder userId(String userId) {
            this.metadata.userId(userId);
            return this;
        }

        public Builder source(String source) {
            this.metadata.source(source);
            return this;
        }

        public Builder timeout(Long timeout) {
            this.metadata.timeout(timeout);
            return this;
        }

        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.metadata.cachePolicy(cachePolicy);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
