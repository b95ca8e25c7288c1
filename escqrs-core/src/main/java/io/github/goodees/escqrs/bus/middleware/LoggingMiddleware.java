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

import io.github.goodees.escqrs.bus.Futures;
import io.github.goodees.escqrs.bus.Message;
import io.github.goodees.escqrs.bus.Middleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletionStage;

/**
 * Logs start, duration and outcome of every message.
 */
public class LoggingMiddleware<M extends Message> implements Middleware<M> {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMiddleware.class);

    private final Clock clock;

    public LoggingMiddleware() {
        this(Clock.systemUTC());
    }

    public LoggingMiddleware(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletionStage<Object> execute(M message, Next<M> next) {
        logger.info("Executing {} {} (correlation {})", message.getMessageType(), message.getId(),
                message.getCorrelationId());
        long start = clock.millis();
        return Futures.invoke(() -> next.proceed(message)).whenComplete((r, t) -> {
            long duration = clock.millis() - start;
            if (t == null) {
                logger.info("Executed {} {} in {}ms", message.getMessageType(), message.getId(), duration);
            } else {
                logger.error("Execution of {} {} failed after {}ms: {}", message.getMessageType(), message.getId(),
                        duration, Futures.unwrap(t).getMessage());
            }
        });
    }
}
