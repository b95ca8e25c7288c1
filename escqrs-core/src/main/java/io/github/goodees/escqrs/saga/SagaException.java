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
 * Saga cannot be started, found or moved to requested state.
 */
public class SagaException extends RuntimeException {
    public SagaException(String message) {
        super(message);
    }

    public SagaException(String message, Throwable cause) {
        super(message, cause);
    }

    static SagaException unknownType(String sagaType) {
        return new SagaException("Saga definition not found: " + sagaType);
    }

    static SagaException notFound(String sagaId) {
        return new SagaException("Saga not found: " + sagaId);
    }

    static SagaException cannotCompensate(String sagaId, SagaStatus status) {
        return new SagaException("Cannot compensate saga " + sagaId + " in status " + status);
    }

    static SagaException stepFailed(String stepId, String reason) {
        return new SagaException("Step " + stepId + " failed: " + reason);
    }
}
