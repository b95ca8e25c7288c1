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

/**
 * Tuning of {@link EventStore} and of repositories built on top of it.
 */
public final class EventStoreOptions {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_SNAPSHOT_FREQUENCY = 50;
    public static final int DEFAULT_SNAPSHOTS_TO_KEEP = 5;
    public static final int DEFAULT_CACHE_MAX_STREAMS = 1000;

    private static final EventStoreOptions DEFAULTS = builder().build();

    private final int batchSize;
    private final int snapshotFrequency;
    private final int snapshotsToKeep;
    private final boolean cacheEnabled;
    private final int cacheMaxStreams;

    private EventStoreOptions(Builder b) {
        this.batchSize = b.batchSize;
        this.snapshotFrequency = b.snapshotFrequency;
        this.snapshotsToKeep = b.snapshotsToKeep;
        this.cacheEnabled = b.cacheEnabled;
        this.cacheMaxStreams = b.cacheMaxStreams;
    }

    public static EventStoreOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Default number of events read from the log at once.
     * @return batch size
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Number of versions between snapshots taken by aggregate repositories. Zero disables snapshots.
     * @return snapshot frequency
     */
    public int getSnapshotFrequency() {
        return snapshotFrequency;
    }

    public int getSnapshotsToKeep() {
        return snapshotsToKeep;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public int getCacheMaxStreams() {
        return cacheMaxStreams;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int snapshotFrequency = DEFAULT_SNAPSHOT_FREQUENCY;
        private int snapshotsToKeep = DEFAULT_SNAPSHOTS_TO_KEEP;
        private boolean cacheEnabled = true;
        private int cacheMaxStreams = DEFAULT_CACHE_MAX_STREAMS;

        private Builder() {
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be positive");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder snapshotFrequency(int snapshotFrequency) {
            if (snapshotFrequency < 0) {
                throw new IllegalArgumentException("Snapshot frequency cannot be negative");
            }
            this.snapshotFrequency = snapshotFrequency;
            return this;
        }

        public Builder snapshotsToKeep(int snapshotsToKeep) {
            if (snapshotsToKeep < 1) {
                throw new IllegalArgumentException("At least one snapshot needs to be kept");
            }
            this.snapshotsToKeep = snapshotsToKeep;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheMaxStreams(int cacheMaxStreams) {
            this.cacheMaxStreams = cacheMaxStreams;
            return this;
        }

        public EventStoreOptions build() {
            return new EventStoreOptions(this);
        }
    }
}
