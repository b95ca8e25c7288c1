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

import io.github.goodees.escqrs.bus.Command;
import io.github.goodees.escqrs.bus.RetryPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single step of a saga: command to send, how to undo it, and where to go next.
 * <p>Commands are templates. Every execution sends a copy with fresh id, correlation id of the saga and the saga id
 * as causation id.</p>
 * <p>Outcome of the step is learned from events declared by {@link Builder#onEvent(String, StepOutcome)}, or from
 * command results passed to {@link SagaManager#handleCommand(Command, Throwable)}.</p>
 */
public final class SagaStep {
    private final String id;
    private final String name;
    private final CommandTemplate command;
    private final CommandTemplate compensation;
    private final Long timeout;
    private final RetryPolicy retryPolicy;
    private final SagaCondition condition;
    private final StepTransition onSuccess;
    private final StepTransition onFailure;
    private final Map<String, StepOutcome> outcomes;

    private SagaStep(Builder b) {
        this.id = Objects.requireNonNull(b.id, "Step id must be set");
        this.name = b.name == null ? b.id : b.name;
        this.command = Objects.requireNonNull(b.command, "Step " + b.id + " needs a command");
        this.compensation = b.compensation;
        this.timeout = b.timeout;
        this.retryPolicy = b.retryPolicy;
        this.condition = b.condition;
        this.onSuccess = b.onSuccess;
        this.onFailure = b.onFailure;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(b.outcomes));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CommandTemplate getCommand() {
        return command;
    }

    public Optional<CommandTemplate> getCompensation() {
        return Optional.ofNullable(compensation);
    }

    public Long getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public SagaCondition getCondition() {
        return condition;
    }

    public StepTransition getOnSuccess() {
        return onSuccess;
    }

    public StepTransition getOnFailure() {
        return onFailure;
    }

    /**
     * Declared outcomes of event types this step waits for.
     * @return event type to outcome
     */
    public Map<String, StepOutcome> getOutcomes() {
        return outcomes;
    }

    @Override
    public String toString() {
        return "SagaStep{" + id + ", name=" + name + '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private CommandTemplate command;
        private CommandTemplate compensation;
        private Long timeout;
        private RetryPolicy retryPolicy;
        private SagaCondition condition;
        private StepTransition onSuccess;
        private StepTransition onFailure;
        private final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder command(Command command) {
            return command(CommandTemplate.of(command));
        }

        public Builder command(CommandTemplate command) {
            this.command = command;
            return this;
        }

        public Builder compensation(Command compensation) {
            return compensation(CommandTemplate.of(compensation));
        }

        public Builder compensation(CommandTemplate compensation) {
            this.compensation = compensation;
            return this;
        }

        public Builder timeout(long timeoutMillis) {
            this.timeout = timeoutMillis;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder condition(SagaCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder onSuccess(StepTransition onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder onFailure(StepTransition onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public Builder onEvent(String eventType, StepOutcome outcome) {
            this.outcomes.put(eventType, outcome);
            return this;
        }

        public Builder succeedsOn(String eventType) {
            return onEvent(eventType, StepOutcome.SUCCESS);
        }

        public Builder failsOn(String eventType) {
            return onEvent(eventType, StepOutcome.FAILURE);
        }

        public SagaStep build() {
            return new SagaStep(this);
        }
    }
}
