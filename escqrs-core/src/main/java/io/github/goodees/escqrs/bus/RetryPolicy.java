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

import java.util.Objects;

/**
 * Retry policy shared by command retries and saga steps.
 */
public final class RetryPolicy {
    public static final long DEFAULT_INITIAL_DELAY = 1000;
    public static final long DEFAULT_MAX_DELAY = 30000;

    private final int maxAttempts;
    private final BackoffStrategy backoffStrategy;
    private final long initialDelay;
    private final long maxDelay;

    public RetryPolicy(int maxAttempts, BackoffStrategy backoffStrategy) {
        this(maxAttempts, backoffStrategy, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    public RetryPolicy(int maxAttempts, BackoffStrategy backoffStrategy, long initialDelay, long maxDelay) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts cannot be negative");
        }
        if (initialDelay < 0 || maxDelay < 0) {
            throw new IllegalArgumentException("Delays cannot be negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoffStrategy = Objects.requireNonNull(backoffStrategy);
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * Number of retries allowed after the first failure.
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffStrategy getBackoffStrategy() {
        return backoffStrategy;
    }

    public long getInitialDelay() {
        return initialDelay;
    }

    public long getMaxDelay() {
        return maxDelay;
    }

    public boolean canRetry(int completedRetries) {
        return completedRetries < maxAttempts;
    }

    /**
     * Delay before given retry.
     * @param attempt number of the retry, starting with 1
     * @return delay in milliseconds, never more than max delay
     */
    public long delayFor(int attempt) {
        int n = Math.max(attempt, 1);
        switch (backoffStrategy) {
            case LINEAR:
                return cap(initialDelay * (double) n);
            case EXPONENTIAL:
                return cap(initialDelay * Math.pow(2, n - 1));
            case FIXED:
            default:
                return initialDelay;
        }
    }

    private long cap(double delay) {
        return delay >= maxDelay ? maxDelay : (long) delay;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" + backoffStrategy + " x" + maxAttempts + ", initial=" + initialDelay + "ms, max="
                + maxDelay + "ms}";
    }
}
