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
 * Request to change state of an aggregate. Handled by exactly one {@link CommandHandler}.
 */
public final class Command implements Message {
    public static final String DEFAULT_SOURCE = "application";

    private final String id;
    private final String commandType;
    private final String aggregateId;
    private final Map<String, Object> payload;
    private final CommandMetadata metadata;
    private final Instant timestamp;
    private final Long expectedVersion;

    private Command(Builder b) {
        this.id = b.id;
        this.commandType = b.commandType;
        this.aggregateId = b.aggregateId;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(b.payload));
        this.metadata = b.metadata.build();
        this.timestamp = b.timestamp;
        this.expectedVersion = b.expectedVersion;
    }

    /**
     * Start a command with fresh id and current timestamp.
     * @param commandType type of command
     * @param aggregateId target aggregate
     * @return builder
     */
    public static Builder builder(String commandType, String aggregateId) {
        return new Builder().id(UUID.randomUUID().toString()).commandType(commandType).aggregateId(aggregateId)
                .correlationId(UUID.randomUUID().toString()).source(DEFAULT_SOURCE).timestamp(Instant.now());
    }

    /**
     * Start an empty command.
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).commandType(commandType).aggregateId(aggregateId).payload(payload)
                .metadata(metadata).timestamp(timestamp).expectedVersion(expectedVersion);
    }

    @Override
    public String getId() {
        return id;
    }

    public String getCommandType() {
        return commandType;
    }

    @Override
    public String getMessageType() {
        return commandType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public CommandMetadata getMetadata() {
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

    /**
     * Version the aggregate is expected to be in, for optimistic concurrency across the command boundary.
     * @return expected version or null
     */
    public Long getExpectedVersion() {
        return expectedVersion;
    }

    @Override
    public String toString() {
        return "Command{" + commandType + " -> " + aggregateId + ", id=" + id + ", " + metadata + '}';
    }

    public static class Builder {
        private String id;
        private String commandType;
        private String aggregateId;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private CommandMetadata.Builder metadata = CommandMetadata.builder();
        private Instant timestamp;
        private Long expectedVersion;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder commandType(String commandType) {
            this.commandType = commandType;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
            return this;
        }

        public Builder put(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }

        public Builder metadata(CommandMetadata metadata) {
            this.metadata = metadata.toBuilder();
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.metadata.correlationId(correlationId);
            return this;
        }

        public Builder causationId(String causationId) {
            this.metadata.causationId(causationId);
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

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.metadata.retryPolicy(retryPolicy);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder expectedVersion(Long expectedVersion) {
            this.expectedVersion = expectedVersion;
            return this;
        }

        public Command build() {
            return new Command(this);
        }
    }
}
