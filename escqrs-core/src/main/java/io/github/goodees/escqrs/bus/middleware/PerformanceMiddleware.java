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

import io.github.goodees.escqrs.bus.Message;
import io.github.goodees.escqrs.bus.Middleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletionStage;

/**
 * Warns about messages whose successful processing took longer than threshold.
 */
public class PerformanceMiddleware<M extends Message> implements Middleware<M> {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceMiddleware.class);

    public static final long DEFAULT_THRESHOLD = 1000;

    private final long threshold;
    private final Clock clock;

    public PerformanceMiddleware() {
        this(DEFAULT_THRESHOLD, Clock.systemUTC());
    }

    public PerformanceMiddleware(long threshold, Clock clock) {
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public CompletionStage<Object> execute(M message, Next<M> next) {
        long start = clock.millis();
        return next.proceed(message).whenComplete((r, t) -> {
            long duration = clock.millis() - start;
            if (t == null && duration > threshold) {
                logger.warn("Slow {} {}: {}ms exceeds threshold of {}ms", message.getMessageType(), message.getId(),
                        duration, threshold);
            }
        });
    }
}
