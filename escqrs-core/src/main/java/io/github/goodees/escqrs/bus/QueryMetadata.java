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

/**
 * Tracing and processing hints of a query.
 */
public final class QueryMetadata {
    private final String correlationId;
    private final String userId;
    private final String source;
    private final Long timeout;
    private final CachePolicy cachePolicy;

    private QueryMetadata(Builder b) {
        this.correlationId = b.correlationId;
        this.userId = b.userId;
        this.source = b.source;
        this.timeout = b.timeout;
        this.cachePolicy = b.cachePolicy;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSource() {
        return source;
    }

    public Long getTimeout() {
        return timeout;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().correlationId(correlationId).userId(userId).source(source).timeout(timeout)
                .cachePolicy(cachePolicy);
    }

    public static class Builder {
        private String correlationId;
        private String userId;
        private String source;
        private Long timeout;
        private CachePolicy cachePolicy;

        private Builder() {
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
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

        public Builder timeout(Long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = cachePolicy;
            return this;
        }

        public QueryMetadata build() {
            return new QueryMetadata(this);
        }
    }
}
