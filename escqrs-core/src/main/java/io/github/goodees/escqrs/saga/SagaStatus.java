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

/**
 * Lifecycle of a saga instance.
 */
public enum SagaStatus {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATING,
    /** Every compensation command was sent. */
    COMPENSATED,
    /** At least one compensation command could not be sent. */
    COMPENSATION_PARTIAL,
    TIMEOUT;

    /**
     * Saga is executing steps and reacts to events.
     */
    public boolean isExecuting() {
        return this == STARTED || this == RUNNING;
    }

    public boolean isActive() {
        return isExecuting() || this == COMPENSATING;
    }

    public boolean canCompensate() {
        return this == STARTED || this == RUNNING || this == FAILED || this == TIMEOUT;
    }
}
