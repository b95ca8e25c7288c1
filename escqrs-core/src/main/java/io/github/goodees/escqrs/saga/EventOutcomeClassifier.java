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

import io.github.goodees.escqrs.event.DomainEvent;

import java.util.Optional;

/**
 * Decides what an event correlated to a saga means for its current step.
 */
@FunctionalInterface
public interface EventOutcomeClassifier {
    /**
     * Classify the event.
     * @param event correlated event
     * @param step current step of the saga
     * @return outcome, or empty if the event only contributes data
     */
    Optional<StepOutcome> classify(DomainEvent event, SagaStep step);
}
