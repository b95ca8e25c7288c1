package io.github.goodees.escqrs.projection;

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

import io.github.goodees.escqrs.event.EventFilter;

import java.util.Objects;

/**
 * Tuning of a {@link Projection}.
 */
public final class ProjectionOptions {
    public static final int DEFAULT_BUFFER_SIZE = 100;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 100;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY = 1000;

    private final int bufferSize;
    private final int checkpointInterval;
    private final int retryAttempts;
    private final long retryDelay;
    private final EventFilter subscriptionFilter;

    private ProjectionOptions(Builder b) {
        if (b.bufferSize < 1 || b.checkpointInterval < 1 || b.retryAttempts < 1 || b.retryDelay < 0) {
            throw new IllegalArgumentException("Invalid projection options");
        }
        this.bufferSize = b.bufferSize;
        this.checkpointInterval = b.checkpointInterval;
        this.retryAttempts = b.retryAttempts;
        this.retryDelay = b.retryDelay;
        this.subscriptionFilter = Objects.requireNonNull(b.subscriptionFilter);
    }

    public static ProjectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of events read from the log at once when catching up.
     */
    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Checkpoint is saved after every this many processed events.
     */
    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    /**
     * Number of errors after which the projection stops.
     */
    public int getRetryAttempts() {
        return retryAttempts;
    }

    /**
     * Milliseconds to wait before retrying a failed event.
     */
    public long getRetryDelay() {
        return retryDelay;
    }

    public EventFilter getSubscriptionFilter() {
        return subscriptionFilter;
    }

    public static class Builder {
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private int checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private long retryDelay = DEFAULT_RETRY_DELAY;
        private EventFilter subscriptionFilter = EventFilter.all();

        private Builder() {
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(long retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder subscriptionFilter(EventFilter subscriptionFilter) {
            this.subscriptionFilter = subscriptionFilter;
            return this;
        }

        public ProjectionOptions build() {
            return new ProjectionOptions(this);
        }
    }
}
