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
 * Schedules saga and step deadlines. Expired deadlines are reported to the bound listener, which only reacts after
 * the fact; running work is never interrupted.
 */
public interface SagaTimeoutManager {
    void bind(TimeoutListener listener);

    void scheduleTimeout(String sagaId, long timeoutMillis);

    void scheduleStepTimeout(String sagaId, String stepId, long timeoutMillis);

    void clearStepTimeout(String sagaId, String stepId);

    /**
     * Clear saga timeout and all step timeouts of the saga.
     */
    void clearTimeout(String sagaId);

    /**
     * Cancel all pending timeouts.
     */
    void shutdown();

    interface TimeoutListener {
        void sagaTimedOut(String sagaId);

        void stepTimedOut(String sagaId, String stepId);
    }
}
