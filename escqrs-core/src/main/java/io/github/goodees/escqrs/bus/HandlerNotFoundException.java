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
 * No handler is registered for message type.
 */
public class HandlerNotFoundException extends BusException {
    private final String messageType;

    protected HandlerNotFoundException(String kind, String messageType) {
        super("No " + kind + " handler registered for " + messageType);
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
