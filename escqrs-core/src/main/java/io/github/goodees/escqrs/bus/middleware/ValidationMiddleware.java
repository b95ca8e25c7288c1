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

import io.github.goodees.escqrs.bus.Command;
import io.github.goodees.escqrs.bus.InvalidCommandException;
import io.github.goodees.escqrs.bus.Middleware;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Stricter command checks than the bus itself performs. Reports all violations at once.
 */
public class ValidationMiddleware implements Middleware<Command> {

    @Override
    public CompletionStage<Object> execute(Command command, Next<Command> next) {
        List<String> errors = validate(command);
        if (!errors.isEmpty()) {
            throw new InvalidCommandException("Command validation failed: " + String.join(", ", errors));
        }
        return next.proceed(command);
    }

    protected List<String> validate(Command command) {
        List<String> errors = new ArrayList<>();
        if (isBlank(command.getId())) {
            errors.add("Command ID is required");
        }
        if (isBlank(command.getCommandType())) {
            errors.add("Command type is required");
        }
        if (isBlank(command.getAggregateId())) {
            errors.add("Aggregate ID is required");
        }
        if (isBlank(command.getCorrelationId())) {
            errors.add("Correlation ID is required in metadata");
        }
        if (isBlank(command.getSource())) {
            errors.add("Source is required in metadata");
        }
        return errors;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
