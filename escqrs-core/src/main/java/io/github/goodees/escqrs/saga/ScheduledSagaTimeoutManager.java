package io.github.goodees.escqrs.saga;

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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Timeouts backed by a {@link ScheduledExecutorService}.
 */
public class ScheduledSagaTimeoutManager implements SagaTimeoutManager {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledSagaTimeoutManager.class);

    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();
    private volatile TimeoutListener listener;

    public ScheduledSagaTimeoutManager(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void bind(TimeoutListener listener) {
        this.listener = listener;
    }

    @Override
    public void scheduleTimeout(String sagaId, long timeoutMillis) {
        schedule(sagaId, timeoutMillis, () -> {
            logger.warn("Saga {} timed out after {}ms", sagaId, timeoutMillis);
            listener().sagaTimedOut(sagaId);
        });
    }

    @Override
    public void scheduleStepTimeout(String sagaId, String stepId, long timeoutMillis) {
        schedule(stepKey(sagaId, stepId), timeoutMillis, () -> {
            logger.warn("Step {} of saga {} timed out after {}ms", stepId, sagaId, timeoutMillis);
            listener().stepTimedOut(sagaId, stepId);
        });
    }

    @Override
    public void clearStepTimeout(String sagaId, String stepId) {
        cancel(stepKey(sagaId, stepId));
    }

    @Override
    public void clearTimeout(String sagaId) {
        cancel(sagaId);
        String prefix = stepKey(sagaId, "");
        timers.keySet().stream().filter(k -> k.startsWith(prefix)).forEach(this::cancel);
    }

    @Override
    public void shutdown() {
        timers.keySet().forEach(this::cancel);
    }

    public int pendingTimeouts() {
        return timers.size();
    }

    private void schedule(String key, long timeoutMillis, Runnable action) {
        Timer timer = new Timer(key, action);
        Timer previous = timers.put(key, timer);
        if (previous != null) {
            previous.cancel();
        }
        timer.future = scheduler.schedule(timer, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void cancel(String key) {
        Timer timer = timers.remove(key);
        if (timer != null) {
            timer.cancel();
        }
    }

    private TimeoutListener listener() {
        TimeoutListener l = listener;
        if (l == null) {
            throw new IllegalStateException("Timeout manager is not bound to a saga manager");
        }
        return l;
    }

    private static String stepKey(String sagaId, String stepId) {
        return sagaId + "/" + stepId;
    }

    private class Timer implements Runnable {
        private final String key;
        private final Runnable action;
        private volatile ScheduledFuture<?> future;

        Timer(String key, Runnable action) {
            this.key = key;
            this.action = action;
        }

        @Override
        public void run() {
            if (timers.remove(key, this)) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    logger.error("Handling of timeout {} failed", key, e);
                }
            }
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
