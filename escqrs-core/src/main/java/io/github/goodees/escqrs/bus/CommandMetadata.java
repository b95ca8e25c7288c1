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
 * Tracing and processing hints of a command.
 */
public final class CommandMetadata {
    private final String correlationId;
    private final String causationId;
    private final String userId;
    private final String source;
    private final Long timeout;
    private final RetryPolicy retryPolicy;

    private CommandMetadata(Builder b) {
        this.correlationId = b.correlationId;
        this.causationId = b.causationId;
        this.userId = b.userId;
        this.source = b.source;
        this.timeout = b.timeout;
        this.retryPolicy = b.retryPolicy;
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

    public Long getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().correlationId(correlationId).causationId(causationId).userId(userId).source(source)
                .timeout(timeout).retryPolicy(retryPolicy);
    }

    @Override
    public String toString() {
        return "CommandMetadata{correlationId=" + correlationId + ", causationId=" + causationId + ", source="
                + source + '}';
    }

    public static class Builder {
        private String correlationId;
        private String causationId;
        private String userId;
        private String source;
        private Long timeout;
        private RetryPolicy retryPolicy;

        private Builder() {
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

        public Builder timeout(Long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public CommandMetadata build() {
            return new CommandMetadata(this);
        }
    }
}
