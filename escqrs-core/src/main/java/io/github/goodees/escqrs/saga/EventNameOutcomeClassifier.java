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
 * Falls back to event naming when the step declares nothing about the event: types containing {@code Completed} or
 * {@code Success} succeed, types containing {@code Failed} or {@code Error} fail.
 */
public class EventNameOutcomeClassifier extends DeclaredOutcomeClassifier {
    @Override
    public Optional<StepOutcome> classify(DomainEvent event, SagaStep step) {
        Optional<StepOutcome> declared = super.classify(event, step);
        if (declared.isPresent()) {
            return declared;
        }
        String type = event.getEventType();
        if (type.contains("Completed") || type.contains("Success")) {
            return Optional.of(StepOutcome.SUCCESS);
        }
        if (type.contains("Failed") || type.contains("Error")) {
            return Optional.of(StepOutcome.FAILURE);
        }
        return Optional.empty();
    }
}
