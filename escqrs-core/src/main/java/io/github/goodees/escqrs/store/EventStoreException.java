package io.github.goodees.escqrs.store;

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

import io.github.goodees.escqrs.event.DomainEvent;

/**
 * Exception generated when storing or reading of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException storeFailed(String streamKey, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Store of stream " + streamKey + " failed. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR, "Reading " + what + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleStreams(String expected, DomainEvent violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple streams: " + expected
                + " and " + violating.getStreamKey(), null);
    }

    public static EventStoreException multipleStreams(String expected, String violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple streams: " + expected
                + " and " + violating, null);
    }

    public static EventStoreException nonMonotonic(String streamKey, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for stream " + streamKey
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + actualVersion, null);
    }

    public static EventStoreException nonMonotonic(String streamKey, long expectedVersion, DomainEvent violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for stream " + streamKey
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + violating.getVersion(),
                null);
    }

    public static EventStoreException serializationFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Cannot serialize " + what + ". "
                + cause.getMessage(), cause);
    }

    public static EventStoreException deserializationFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Cannot deserialize " + what + ". "
                + cause.getMessage(), cause);
    }
}
