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

/**
 * Message was not processed within the timeout of its metadata. The handler may still be running.
 */
public class BusTimeoutException extends BusException {
    private final long timeout;

    public BusTimeoutException(Message message, long timeout) {
        super(message.getMessageType() + " " + message.getId() + " timed out after " + timeout + "ms");
        this.timeout = timeout;
    }

    public long getTimeout() {
        return timeout;
    }
}
