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

import io.github.goodees.escqrs.bus.RetryPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a saga type. Steps are executed starting with the first one, following transitions.
 */
public final class SagaDefinition {
    private final String name;
    private final String version;
    private final List<SagaStep> steps;
    private final Map<String, SagaStep> stepsById;
    private final Long timeout;
    private final CompensationStrategy compensationStrategy;
    private final RetryPolicy retryPolicy;

    private SagaDefinition(Builder b) {
        this.name = Objects.requireNonNull(b.name, "Saga name must be set");
        this.version = b.version;
        if (b.steps.isEmpty()) {
            throw new IllegalArgumentException("Saga " + name + " has no steps");
        }
        Map<String, SagaStep> byId = new LinkedHashMap<>();
        for (SagaStep step : b.steps) {
            if (byId.put(step.getId(), step) != null) {
                throw new IllegalArgumentException("Duplicate step " + step.getId() + " in saga " + name);
            }
        }
        for (SagaStep step : b.steps) {
            checkTarget(byId, step, step.getOnSuccess());
            checkTarget(byId, step, step.getOnFailure());
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(b.steps));
        this.stepsById = Collections.unmodifiableMap(byId);
        this.timeout = b.timeout;
        this.compensationStrategy = b.compensationStrategy;
        this.retryPolicy = b.retryPolicy;
    }

    private void checkTarget(Map<String, SagaStep> byId, SagaStep step, StepTransition transition) {
        if (transition != null && transition.getNextStep() != null && !byId.containsKey(transition.getNextStep())) {
            throw new IllegalArgumentException("Step " + step.getId() + " of saga " + name
                    + " refers to unknown step " + transition.getNextStep());
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<SagaStep> getSteps() {
        return steps;
    }

    public Optional<SagaStep> getStep(String stepId) {
        return Optional.ofNullable(stepId == null ? null : stepsById.get(stepId));
    }

    public SagaStep getFirstStep() {
        return steps.get(0);
    }

    public Long getTimeout() {
        return timeout;
    }

    public CompensationStrategy getCompensationStrategy() {
        return compensationStrategy;
    }

    /**
     * Retry policy of steps that don't declare their own.
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    RetryPolicy retryPolicyOf(SagaStep step) {
        return step.getRetryPolicy() != null ? step.getRetryPolicy() : retryPolicy;
    }

    public static class Builder {
        private final String name;
        private String version = "1";
        private final List<SagaStep> steps = new ArrayList<>();
        private Long timeout;
        private CompensationStrategy compensationStrategy = CompensationStrategy.REVERSE_ORDER;
        private RetryPolicy retryPolicy;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder step(SagaStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder timeout(long timeoutMillis) {
            this.timeout = timeoutMillis;
            return this;
        }

        public Builder compensationStrategy(CompensationStrategy compensationStrategy) {
            this.compensationStrategy = Objects.requireNonNull(compensationStrategy);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public SagaDefinition build() {
            return new SagaDefinition(this);
        }
    }
}
