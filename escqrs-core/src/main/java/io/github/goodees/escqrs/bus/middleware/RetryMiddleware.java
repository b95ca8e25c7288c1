package io.github.goodees.escqrs.bus.middleware;

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

import io.github.goodees.escqrs.aggregate.AggregateNotFoundException;
import io.github.goodees.escqrs.bus.BackoffStrategy;
import io.github.goodees.escqrs.bus.Command;
import io.github.goodees.escqrs.bus.Futures;
import io.github.goodees.escqrs.bus.HandlerNotFoundException;
import io.github.goodees.escqrs.bus.InvalidMessageException;
import io.github.goodees.escqrs.bus.Middleware;
import io.github.goodees.escqrs.bus.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Re-runs the rest of the chain when a command fails with a retryable error. The command's own retry policy takes
 * precedence over the one of the middleware.
 */
public class RetryMiddleware implements Middleware<Command> {
    private static final Logger logger = LoggerFactory.getLogger(RetryMiddleware.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY = 1000;

    private final ScheduledExecutorService scheduler;
    private final RetryPolicy defaultPolicy;

    public RetryMiddleware(ScheduledExecutorService scheduler) {
        this(scheduler, DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    public RetryMiddleware(ScheduledExecutorService scheduler, int maxRetries, long baseDelay) {
        this(scheduler, new RetryPolicy(maxRetries, BackoffStrategy.EXPONENTIAL, baseDelay,
                RetryPolicy.DEFAULT_MAX_DELAY));
    }

    public RetryMiddleware(ScheduledExecutorService scheduler, RetryPolicy defaultPolicy) {
        this.scheduler = scheduler;
        this.defaultPolicy = defaultPolicy;
    }

    @Override
    public CompletionStage<Object> execute(Command command, Next<Command> next) {
        RetryPolicy policy = command.getMetadata().getRetryPolicy() != null
                ? command.getMetadata().getRetryPolicy()
                : defaultPolicy;
        CompletableFuture<Object> result = new CompletableFuture<>();
        attempt(command, next, policy, 0, result);
        return result;
    }

    private void attempt(Command command, Next<Command> next, RetryPolicy policy, int retries,
            CompletableFuture<Object> result) {
        Futures.invoke(() -> next.proceed(command)).whenComplete((r, t) -> {
            if (t == null) {
                result.complete(r);
                return;
            }
            Throwable cause = Futures.unwrap(t);
            if (policy.canRetry(retries) && isRetryable(cause)) {
                long delay = policy.delayFor(retries + 1);
                logger.warn("Command {} failed on attempt {}, retrying in {}ms: {}", command.getId(), retries + 1,
                        delay, cause.getMessage());
                scheduler.schedule(() -> attempt(command, next, policy, retries + 1, result), delay,
                        TimeUnit.MILLISECONDS);
            } else {
                logger.error("Command {} failed permanently after {} attempts", command.getId(), retries + 1, cause);
                result.completeExceptionally(cause);
            }
        });
    }

    protected boolean isRetryable(Throwable error) {
        if (error instanceof InvalidMessageException || error instanceof HandlerNotFoundException
                || error instanceof AggregateNotFoundException) {
            return false;
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        return !message.contains("validation") && !message.contains("not found");
    }
}
