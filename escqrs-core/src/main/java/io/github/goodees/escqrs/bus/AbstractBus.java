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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Handler registry, middleware chain, timeouts and metrics common to both buses.
 * @param <M> message type
 * @param <H> handler type
 */
abstract class AbstractBus<M extends Message, H> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final ConcurrentMap<String, H> handlers = new ConcurrentHashMap<>();
    private final List<Middleware<M>> middlewares = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private volatile boolean shutdown;
    protected final MetricsRecorder metrics = new MetricsRecorder();
    protected final Clock clock;

    protected AbstractBus(ScheduledExecutorService scheduler, Clock clock) {
        this(scheduler, clock, false);
    }

    /**
     * @param ownsScheduler whether {@link #shutdown()} should stop the scheduler
     */
    protected AbstractBus(ScheduledExecutorService scheduler, Clock clock, boolean ownsScheduler) {
        this.scheduler = Objects.requireNonNull(scheduler);
        this.clock = Objects.requireNonNull(clock);
        this.ownsScheduler = ownsScheduler;
    }

    static ScheduledExecutorService defaultScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register handler of a message type.
     * @throws IllegalArgumentException when the type already has a handler
     */
    public void register(String messageType, H handler) {
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(messageType, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for " + messageType);
        }
        logger.debug("Registered handler for {}", messageType);
    }

    public boolean unregister(String messageType) {
        return handlers.remove(messageType) != null;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    /**
     * Append middleware. First registered is the outermost one.
     */
    public void use(Middleware<M> middleware) {
        middlewares.add(Objects.requireNonNull(middleware));
    }

    /**
     * Stop accepting messages and stop the timeout scheduler the bus created for itself. A scheduler passed in by
     * the caller stays running. Pending timeouts of an own scheduler no longer fire.
     */
    public void shutdown() {
        shutdown = true;
        if (ownsScheduler) {
            scheduler.shutdownNow();
            logger.debug("Timeout scheduler stopped");
        }
    }

    public BusMetrics getMetrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    protected abstract RuntimeException handlerNotFound(String messageType);

    protected abstract CompletionStage<?> invokeHandler(H handler, M message) throws Exception;

    /**
     * Called with successful result before the caller sees it.
     */
    protected void onSuccess(M message, Object result) {
    }

    /**
     * Look up the handler and run the message through middlewares. Message must already be validated.
     */
    protected CompletableFuture<Object> process(M message) {
        String type = message.getMessageType();
        if (shutdown) {
            return Futures.failed(new IllegalStateException(getClass().getSimpleName() + " is shut down"));
        }
        H handler = handlers.get(type);
        if (handler == null) {
            metrics.record(type, 0, false);
            return Futures.failed(handlerNotFound(type));
        }
        long start = clock.millis();
        List<Middleware<M>> chain = new ArrayList<>(middlewares);
        CompletableFuture<Object> processing = proceed(chain, 0, handler, message);

        CompletableFuture<Object> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduleTimeout(message, result);
        processing.whenComplete((r, t) -> {
            if (timer != null) {
                timer.cancel(false);
            }
            boolean success = t == null && !result.isDone();
            metrics.record(type, clock.millis() - start, success);
            if (t == null) {
                if (success) {
                    onSuccess(message, r);
                }
                result.complete(r);
            } else {
                Throwable cause = Futures.unwrap(t);
                logger.debug("Processing of {} failed", message, cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    private ScheduledFuture<?> scheduleTimeout(M message, CompletableFuture<Object> result) {
        Long timeout = message.getTimeout();
        if (timeout == null || timeout <= 0) {
            return null;
        }
        return scheduler.schedule(() -> {
            if (result.completeExceptionally(new BusTimeoutException(message, timeout))) {
                logger.warn("{} timed out after {}ms", message, timeout);
            }
        }, timeout, TimeUnit.MILLISECONDS);
    }

    private CompletableFuture<Object> proceed(List<Middleware<M>> chain, int index, H handler, M message) {
        if (index >= chain.size()) {
            return callHandler(handler, message);
        }
        Middleware<M> middleware = chain.get(index);
        try {
            CompletionStage<Object> stage = middleware.execute(message, m -> proceed(chain, index + 1, handler, m));
            return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
        } catch (Exception e) {
            return Futures.failed(e);
        }
    }

    private CompletableFuture<Object> callHandler(H handler, M message) {
        CompletionStage<?> stage;
        try {
            stage = invokeHandler(handler, message);
        } catch (Exception e) {
            return Futures.failed(e);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }
        return stage.toCompletableFuture().thenApply(r -> (Object) r);
    }

    @SuppressWarnings("unchecked")
    static <R> CompletableFuture<R> typed(CompletableFuture<Object> future) {
        return (CompletableFuture<R>) (CompletableFuture<?>) future;
    }

    static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
