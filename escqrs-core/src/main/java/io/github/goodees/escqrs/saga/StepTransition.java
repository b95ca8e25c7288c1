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

import java.util.Objects;

/**
 * Where a saga goes after a step succeeds or fails.
 */
public final class StepTransition {
    private static final StepTransition END = new StepTransition(null, true, false);
    private static final StepTransition COMPENSATE = new StepTransition(null, false, true);

    private final String nextStep;
    private final boolean endSaga;
    private final boolean compensate;

    private StepTransition(String nextStep, boolean endSaga, boolean compensate) {
        this.nextStep = nextStep;
        this.endSaga = endSaga;
        this.compensate = compensate;
    }

    public static StepTransition nextStep(String stepId) {
        return new StepTransition(Objects.requireNonNull(stepId), false, false);
    }

    public static StepTransition endSaga() {
        return END;
    }

    public static StepTransition compensate() {
        return COMPENSATE;
    }

    public String getNextStep() {
        return nextStep;
    }

    public boolean isEndSaga() {
        return endSaga;
    }

    public boolean isCompensate() {
        return compensate;
    }

    @Override
    public String toString() {
        if (nextStep != null) {
            return "-> " + nextStep;
        }
        return endSaga ? "-> end" : "-> compensate";
    }
}
