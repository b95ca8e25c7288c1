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

import java.time.Instant;

/**
 * Common envelope of commands and queries.
 */
public interface Message {
    String getId();

    /**
     * Type tag the handler is registered under.
     * @return message type
     */
    String getMessageType();

    String getCorrelationId();

    String getUserId();

    String getSource();

    /**
     * Time limit of processing.
     * @return timeout in milliseconds, null if unlimited
     */
    Long getTimeout();

    Instant getTimestamp();
}
