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
 * Observer of saga lifecycle. Receives copies of the instance.
 */
public interface SagaListener {
    default void sagaStarted(SagaInstance saga) {
    }

    default void stepCompleted(SagaInstance saga, String stepId) {
    }

    default void sagaCompleted(SagaInstance saga) {
    }

    default void sagaFailed(SagaInstance saga, Throwable cause) {
    }

    /**
     * Compensation finished, status is either {@link SagaStatus#COMPENSATED} or
     * {@link SagaStatus#COMPENSATION_PARTIAL}.
     */
    default void sagaCompensated(SagaInstance saga) {
    }

    default void sagaTimedOut(SagaInstance saga) {
    }
}
