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

import io.github.goodees.escqrs.bus.Command;
import io.github.goodees.escqrs.bus.CommandBus;
import io.github.goodees.escqrs.bus.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * Sends saga commands through {@link CommandBus}. Failures the bus reports immediately (invalid command, missing
 * handler, synchronous handler failure) are thrown to the saga. Results completing later are passed to the optional
 * result listener, typically {@link SagaManager#handleCommand(Command, Throwable)}.
 */
public class CommandBusSender implements CommandSender {
    private static final Logger logger = LoggerFactory.getLogger(CommandBusSender.class);

    private final CommandBus commandBus;
    private volatile BiConsumer<Command, Throwable> resultListener;

    public CommandBusSender(CommandBus commandBus) {
        this.commandBus = commandBus;
    }

    public CommandBusSender onResult(BiConsumer<Command, Throwable> resultListener) {
        this.resultListener = resultListener;
        return this;
    }

    @Override
    public void send(Command command) throws Exception {
        CompletableFuture<Object> result = commandBus.send(command);
        if (result.isCompletedExceptionally()) {
            Throwable cause = failureOf(result);
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw new SagaException("Sending " + command + " failed", cause);
        }
        result.whenComplete((r, t) -> {
            Throwable failure = t == null ? null : Futures.unwrap(t);
            if (failure != null) {
                logger.warn("Command {} failed: {}", command.getId(), failure.getMessage());
            }
            BiConsumer<Command, Throwable> listener = resultListener;
            if (listener != null) {
                listener.accept(command, failure);
            }
        });
    }

    private static Throwable failureOf(CompletableFuture<Object> result) {
        try {
            result.join();
            return null;
        } catch (RuntimeException e) {
            return Futures.unwrap(e);
        }
    }
}
