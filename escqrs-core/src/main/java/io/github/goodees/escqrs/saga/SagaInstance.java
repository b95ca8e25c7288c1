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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime state of a saga. Mutated only by {@link SagaManager}; everything handed out of it is a copy.
 */
public class SagaInstance {
    private final String id;
    private final String sagaType;
    private final String version;
    private final String correlationId;
    private final Instant startedAt;
    private SagaStatus status;
    private String currentStep;
    private final Map<String, Object> data;
    private final List<String> completedSteps;
    private int retryCount;
    private String currentCommandId;
    private String failureReason;
    private Instant updatedAt;
    private Instant completedAt;
    private Instant compensatedAt;

    public SagaInstance(String id, String sagaType, String version, String correlationId, String firstStep,
            Map<String, Object> data, Instant startedAt) {
        this.id = id;
        this.sagaType = sagaType;
        this.version = version;
        this.correlationId = correlationId;
        this.currentStep = firstStep;
        this.data = new LinkedHashMap<>(data == null ? Collections.emptyMap() : data);
        this.completedSteps = new ArrayList<>();
        this.status = SagaStatus.STARTED;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
    }

    private SagaInstance(SagaInstance other) {
        this.id = other.id;
        this.sagaType = other.sagaType;
        this.version = other.version;
        this.correlationId = other.correlationId;
        this.startedAt = other.startedAt;
        this.status = other.status;
        this.currentStep = other.currentStep;
        this.data = new LinkedHashMap<>(other.data);
        this.completedSteps = new ArrayList<>(other.completedSteps);
        this.retryCount = other.retryCount;
        this.currentCommandId = other.currentCommandId;
        this.failureReason = other.failureReason;
        this.updatedAt = other.updatedAt;
        this.completedAt = other.completedAt;
        this.compensatedAt = other.compensatedAt;
    }

    public SagaInstance copy() {
        return new SagaInstance(this);
    }

    public String getId() {
        return id;
    }

    public String getSagaType() {
        return sagaType;
    }

    public String getVersion() {
        return version;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public SagaStatus getStatus() {
        return status;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * Steps whose command completed successfully, in order of completion.
     */
    public List<String> getCompletedSteps() {
        return Collections.unmodifiableList(completedSteps);
    }

    /**
     * Retries of the current step so far.
     */
    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Id of the command most recently sent for the current step.
     */
    public String getCurrentCommandId() {
        return currentCommandId;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getCompensatedAt() {
        return compensatedAt;
    }

    void status(SagaStatus status, Instant now) {
        this.status = status;
        this.updatedAt = now;
        if (status == SagaStatus.COMPLETED) {
            this.completedAt = now;
        } else if (status == SagaStatus.COMPENSATED || status == SagaStatus.COMPENSATION_PARTIAL) {
            this.compensatedAt = now;
        }
    }

    void moveTo(String stepId, Instant now) {
        this.currentStep = stepId;
        this.retryCount = 0;
        this.currentCommandId = null;
        this.updatedAt = now;
    }

    void mergeData(Map<String, Object> values, Instant now) {
        this.data.putAll(values);
        this.updatedAt = now;
    }

    void stepCompleted(String stepId, Instant now) {
        this.completedSteps.add(stepId);
        this.currentCommandId = null;
        this.updatedAt = now;
    }

    int incrementRetries() {
        return ++retryCount;
    }

    void commandSent(String commandId) {
        this.currentCommandId = commandId;
    }

    void failed(String reason) {
        this.failureReason = reason;
    }

    @Override
    public String toString() {
        return "SagaInstance{" + sagaType + ' ' + id + ", status=" + status + ", step=" + currentStep
                + ", correlationId=" + correlationId + '}';
    }
}
