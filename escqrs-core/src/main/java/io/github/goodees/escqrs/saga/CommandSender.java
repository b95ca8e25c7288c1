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

/**
 * Delivers saga commands. Returns once the command is handed over; its effects come back as events or through
 * {@link SagaManager#handleCommand(Command, Throwable)}.
 */
@FunctionalInterface
public interface CommandSender {
    /**
     * Send the command.
     * @param command command to send
     * @throws Exception when the command could not be handed over
     */
    void send(Command command) throws Exception;
}
