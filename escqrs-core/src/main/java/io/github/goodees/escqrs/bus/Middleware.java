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

import java.util.concurrent.CompletionStage;

/**
 * Wraps processing of a message. Middlewares run in registration order, each deciding whether and how to call
 * the rest of the chain, the handler being the innermost link.
 * @param <M> command or query
 */
@FunctionalInterface
public interface Middleware<M extends Message> {
    CompletionStage<Object> execute(M message, Next<M> next) throws Exception;

    @FunctionalInterface
    interface Next<M extends Message> {
        CompletionStage<Object> proceed(M message);
    }
}
