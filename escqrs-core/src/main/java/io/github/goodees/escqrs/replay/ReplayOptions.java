package io.github.goodees.escqrs.replay;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tuning of an {@link EventReplay} run.
 */
public final class ReplayOptions {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final long DEFAULT_DELAY_BETWEEN_BATCHES = 100;

    private final int batchSize;
    private final long delayBetweenBatches;
    private final boolean validateOrder;
    private final boolean stopOnError;
    private final long fromPosition;
    private final long toPosition;
    private final Set<String> skipEventTypes;

    private ReplayOptions(Builder b) {
        if (b.batchSize < 1 || b.delayBetweenBatches < 0 || b.fromPosition < 0 || b.toPosition < b.fromPosition) {
            throw new IllegalArgumentException("Invalid replay options");
        }
        this.batchSize = b.batchSize;
        this.delayBetweenBatches = b.delayBetweenBatches;
        this.validateOrder = b.validateOrder;
        this.stopOnError = b.stopOnError;
        this.fromPosition = b.fromPosition;
        this.toPosition = b.toPosition;
        this.skipEventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.skipEventTypes));
    }

    public static ReplayOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of events read from the log at once.
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Milliseconds to rest after each batch.
     */
    public long getDelayBetweenBatches() {
        return delayBetweenBatches;
    }

    /**
     * Whether an event with a version not above the previously replayed version of its stream is reported as error.
     */
    public boolean isValidateOrder() {
        return validateOrder;
    }

    /**
     * Whether the first failed event fails the whole replay.
     */
    public boolean isStopOnError() {
        return stopOnError;
    }

    /**
     * Replay starts after this position.
     */
    public long getFromPosition() {
        return fromPosition;
    }

    /**
     * Last position included in the replay.
     */
    public long getToPosition() {
        return toPosition;
    }

    public Set<String> getSkipEventTypes() {
        return skipEventTypes;
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private long delayBetweenBatches = DEFAULT_DELAY_BETWEEN_BATCHES;
        private boolean validateOrder = true;
        private boolean stopOnError;
        private long fromPosition;
        private long toPosition = Long.MAX_VALUE;
        private final Set<String> skipEventTypes = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder delayBetweenBatches(long delayBetweenBatches) {
            this.delayBetweenBatches = delayBetweenBatches;
            return this;
        }

        public Builder validateOrder(boolean validateOrder) {
            this.validateOrder = validateOrder;
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public Builder fromPosition(long fromPosition) {
            this.fromPosition = fromPosition;
            return this;
        }

        public Builder toPosition(long toPosition) {
            this.toPosition = toPosition;
            return this;
        }

        public Builder skipEventTypes(String... types) {
            this.skipEventTypes.addAll(Arrays.asList(types));
            return this;
        }

        public ReplayOptions build() {
            return new ReplayOptions(this);
        }
    }
}
