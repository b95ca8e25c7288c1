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

import java.util.Map;

/**
 * Produces the command of a step from the data the saga collected. Id, correlation id, causation id and timestamp
 * of the produced command are replaced when it is sent.
 */
@FunctionalInterface
public interface CommandTemplate {
    Command create(Map<String, Object> data);

    static CommandTemplate of(Command command) {
        return data -> command;
    }
}
