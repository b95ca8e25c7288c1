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

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Routes every command to the single handler registered for its type.
 */
public class CommandBus extends AbstractBus<Command, CommandHandler> {

    /**
     * Bus with its own timeout scheduler, stopped by {@link #shutdown()}.
     */
    public CommandBus() {
        super(defaultScheduler("command-bus-timer"), Clock.systemUTC(), true);
    }

    public CommandBus(ScheduledExecutorService scheduler, Clock clock) {
        super(scheduler, clock);
    }

    /**
     * Send command to its handler. Invalid commands and commands without handler fail before any middleware runs.
     * @param command the command
     * @param <R> result type of the handler
     * @return handler's result
     */
    public <R> CompletableFuture<R> send(Command command) {
        try {
            validate(command);
        } catch (InvalidCommandException e) {
            metrics.record(command == null || command.getCommandType() == null ? "unknown" : command.getCommandType(),
                    0, false);
            return Futures.failed(e);
        }
        return typed(process(command));
    }

    static void validate(Command command) {
        if (command == null) {
            throw new InvalidCommandException("Command is missing");
        }
        if (isBlank(command.getId())) {
            throw new InvalidCommandException("Command id is required");
        }
        if (isBlank(command.getCommandType())) {
            throw new InvalidCommandException("Command type is required");
        }
        if (isBlank(command.getAggregateId())) {
            throw new InvalidCommandException("Aggregate id is required for " + command.getCommandType());
        }
        if (isBlank(command.getCorrelationId())) {
            throw new InvalidCommandException("Correlation id is required for " + command.getCommandType());
        }
        if (command.getTimestamp() == null) {
            throw new InvalidCommandException("Command timestamp is required");
        }
    }

    @Override
    protected RuntimeException handlerNotFound(String messageType) {
        return new CommandHandlerNotFoundException(messageType);
    }

    @Override
    protected CompletionStage<?> invokeHandler(CommandHandler handler, Command message) throws Exception {
        return handler.handle(message);
    }
}
