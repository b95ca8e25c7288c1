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
import io.github.goodees.escqrs.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Orchestrates sagas: executes steps by sending commands, advances on correlated events or command results, retries
 * and times out steps, and compensates completed steps when asked to.
 *
 * <p>All state transitions of one manager are serialized. Timer and retry callbacks run on the scheduler threads
 * and take the same lock.</p>
 */
public class SagaManager {
    private static final Logger logger = LoggerFactory.getLogger(SagaManager.class);

    private static final Set<SagaStatus> ACTIVE = EnumSet.of(SagaStatus.STARTED, SagaStatus.RUNNING,
            SagaStatus.COMPENSATING);

    private final ConcurrentMap<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, SagaInstance> instances = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> pendingCommands = new ConcurrentHashMap<>();
    private final List<SagaListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private final SagaRepository repository;
    private final CommandSender commandSender;
    private final SagaTimeoutManager timeoutManager;
    private final ScheduledExecutorService scheduler;
    private final EventOutcomeClassifier classifier;
    private final Supplier<String> idGenerator;
    private final Clock clock;

    public SagaManager(SagaRepository repository, CommandSender commandSender, ScheduledExecutorService scheduler) {
        this(repository, commandSender, new ScheduledSagaTimeoutManager(scheduler), scheduler,
                new DeclaredOutcomeClassifier(), () -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public SagaManager(SagaRepository repository, CommandSender commandSender, SagaTimeoutManager timeoutManager,
            ScheduledExecutorService scheduler, EventOutcomeClassifier classifier, Supplier<String> idGenerator,
            Clock clock) {
        this.repository = repository;
        this.commandSender = commandSender;
        this.timeoutManager = timeoutManager;
        this.scheduler = scheduler;
        this.classifier = classifier;
        this.idGenerator = idGenerator;
        this.clock = clock;
        timeoutManager.bind(new SagaTimeoutManager.TimeoutListener() {
            @Override
            public void sagaTimedOut(String sagaId) {
                onSagaTimeout(sagaId);
            }

            @Override
            public void stepTimedOut(String sagaId, String stepId) {
                onStepTimeout(sagaId, stepId);
            }
        });
    }

    /**
     * Register saga type.
     * @throws IllegalArgumentException when a definition of the same name is already registered
     */
    public void registerSaga(SagaDefinition definition) {
        if (definitions.putIfAbsent(definition.getName(), definition) != null) {
            throw new IllegalArgumentException("Saga already registered: " + definition.getName());
        }
        logger.info("Saga definition {} version {} registered", definition.getName(), definition.getVersion());
    }

    public void addListener(SagaListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SagaListener listener) {
        listeners.remove(listener);
    }

    /**
     * Start new saga and execute its first step.
     * @param sagaType name of registered definition
     * @param data initial data of the saga
     * @param correlationId correlation id of events and commands the saga reacts to
     * @return state of the saga after first step was executed
     * @throws SagaException when saga type is unknown
     */
    public SagaInstance startSaga(String sagaType, Map<String, Object> data, String correlationId) {
        SagaDefinition definition = definition(sagaType);
        synchronized (lock) {
            SagaInstance saga = new SagaInstance(idGenerator.get(), sagaType, definition.getVersion(), correlationId,
                    definition.getFirstStep().getId(), data, clock.instant());
            instances.put(saga.getId(), saga);
            repository.save(saga);
            if (definition.getTimeout() != null) {
                timeoutManager.scheduleTimeout(saga.getId(), definition.getTimeout());
            }
            logger.info("Saga {} of type {} started, correlation {}", saga.getId(), sagaType, correlationId);
            notifyListeners(saga, l -> l.sagaStarted(saga.copy()));
            executeStep(saga, definition);
            return saga.copy();
        }
    }

    /**
     * Route event to executing sagas sharing its correlation id. Events without correlation id are ignored.
     */
    public void handleEvent(DomainEvent event) {
        String correlationId = event.getMetadata().getCorrelationId();
        if (correlationId == null) {
            return;
        }
        synchronized (lock) {
            for (SagaInstance stored : repository.findByCorrelationId(correlationId)) {
                if (!stored.getStatus().isExecuting()) {
                    continue;
                }
                SagaInstance saga = live(stored.getId(), SagaStatus::isExecuting);
                if (saga == null || !saga.getStatus().isExecuting()) {
                    continue;
                }
                SagaDefinition definition = definitions.get(saga.getSagaType());
                if (definition == null) {
                    logger.warn("Saga {} has unregistered type {}", saga.getId(), saga.getSagaType());
                    continue;
                }
                Optional<SagaStep> step = definition.getStep(saga.getCurrentStep());
                if (!step.isPresent()) {
                    continue;
                }
                saga.mergeData(Collections.singletonMap("lastEvent", summary(event)), clock.instant());
                Optional<StepOutcome> outcome = classifier.classify(event, step.get());
                if (!outcome.isPresent()) {
                    repository.save(saga);
                } else if (outcome.get() == StepOutcome.SUCCESS) {
                    stepSucceeded(saga, definition, step.get());
                } else {
                    handleStepFailure(saga, definition, step.get(),
                            SagaException.stepFailed(step.get().getId(), event.getEventType()));
                }
            }
        }
    }

    /**
     * Report result of a command the saga sent for its current step. Commands not sent by this manager, and
     * results arriving after the saga moved on, are ignored.
     * @param command the command
     * @param failure failure of the command, or null if it succeeded
     */
    public void handleCommand(Command command, Throwable failure) {
        String sagaId = pendingCommands.get(command.getId());
        if (sagaId == null) {
            return;
        }
        String causationId = command.getMetadata().getCausationId();
        if (causationId != null && !causationId.equals(sagaId)) {
            return;
        }
        synchronized (lock) {
            SagaInstance saga = instances.get(sagaId);
            if (saga == null || !saga.getStatus().isExecuting()
                    || !command.getId().equals(saga.getCurrentCommandId())) {
                return;
            }
            pendingCommands.remove(command.getId());
            SagaDefinition definition = definitions.get(saga.getSagaType());
            Optional<SagaStep> step = definition == null
                    ? Optional.empty()
                    : definition.getStep(saga.getCurrentStep());
            if (!step.isPresent()) {
                return;
            }
            if (failure == null) {
                saga.mergeData(Collections.singletonMap("lastCommandResult", summary(command)), clock.instant());
                stepSucceeded(saga, definition, step.get());
            } else {
                handleStepFailure(saga, definition, step.get(), failure);
            }
        }
    }

    /**
     * Compensate completed steps of a saga.
     * @throws SagaException when saga doesn't exist or is not in a state that permits compensation
     */
    public void compensateSaga(String sagaId) {
        synchronized (lock) {
            SagaInstance saga = live(sagaId, SagaStatus::canCompensate);
            if (saga == null) {
                throw SagaException.notFound(sagaId);
            }
            if (!saga.getStatus().canCompensate()) {
                throw SagaException.cannotCompensate(sagaId, saga.getStatus());
            }
            compensate(saga, definition(saga.getSagaType()));
        }
    }

    public Optional<SagaInstance> getSaga(String sagaId) {
        synchronized (lock) {
            SagaInstance saga = instances.get(sagaId);
            return saga != null ? Optional.of(saga.copy()) : repository.findById(sagaId);
        }
    }

    /**
     * Sagas that are started, running or compensating.
     */
    public List<SagaInstance> getActiveSagas() {
        return repository.findByStatus(ACTIVE);
    }

    /**
     * Cancel pending timeouts. The scheduler is owned by the caller and stays running.
     */
    public void shutdown() {
        timeoutManager.shutdown();
        logger.info("Saga manager shut down with {} active sagas", instances.size());
    }

    private SagaDefinition definition(String sagaType) {
        SagaDefinition definition = definitions.get(sagaType);
        if (definition == null) {
            throw SagaException.unknownType(sagaType);
        }
        return definition;
    }

    /**
     * In-memory instance of a saga, loaded from the repository when needed. A loaded saga is kept in memory only
     * when its status admits the operation at hand.
     */
    private SagaInstance live(String sagaId, Predicate<SagaStatus> admitted) {
        SagaInstance saga = instances.get(sagaId);
        if (saga == null) {
            Optional<SagaInstance> stored = repository.findById(sagaId);
            if (stored.isPresent()) {
                saga = stored.get();
                if (admitted.test(saga.getStatus())) {
                    instances.put(sagaId, saga);
                }
            }
        }
        return saga;
    }

    /**
     * Number of sagas held in memory.
     */
    int liveSagaCount() {
        synchronized (lock) {
            return instances.size();
        }
    }

    private void executeStep(SagaInstance saga, SagaDefinition definition) {
        Optional<SagaStep> current = definition.getStep(saga.getCurrentStep());
        if (!current.isPresent()) {
            complete(saga);
            return;
        }
        SagaStep step = current.get();
        saga.status(SagaStatus.RUNNING, clock.instant());
        repository.save(saga);

        if (step.getCondition() != null && !conditionHolds(saga, step)) {
            logger.debug("Skipping step {} of saga {}, condition not met", step.getId(), saga.getId());
            followTransition(saga, definition, step.getOnSuccess());
            return;
        }

        Command command;
        try {
            command = prepareCommand(step.getCommand(), saga);
        } catch (RuntimeException e) {
            logger.error("Cannot create command of step {} of saga {}", step.getId(), saga.getId(), e);
            handleStepFailure(saga, definition, step, e);
            return;
        }
        saga.commandSent(command.getId());
        pendingCommands.put(command.getId(), saga.getId());
        repository.save(saga);
        try {
            commandSender.send(command);
        } catch (Exception e) {
            pendingCommands.remove(command.getId());
            logger.error("Sending {} for step {} of saga {} failed", command.getCommandType(), step.getId(),
                    saga.getId(), e);
            if (awaits(saga, step, command)) {
                handleStepFailure(saga, definition, step, e);
            }
            return;
        }
        if (!awaits(saga, step, command)) {
            // outcome was already reported while sending
            return;
        }
        if (step.getTimeout() != null) {
            timeoutManager.scheduleStepTimeout(saga.getId(), step.getId(), step.getTimeout());
        }
        logger.debug("Step {} of saga {} sent {}", step.getId(), saga.getId(), command.getCommandType());
    }

    private boolean awaits(SagaInstance saga, SagaStep step, Command command) {
        return saga.getStatus() == SagaStatus.RUNNING && step.getId().equals(saga.getCurrentStep())
                && command.getId().equals(saga.getCurrentCommandId());
    }

    private boolean conditionHolds(SagaInstance saga, SagaStep step) {
        try {
            return step.getCondition().test(saga.getData());
        } catch (RuntimeException e) {
            logger.warn("Condition of step {} of saga {} failed, treating as not met", step.getId(), saga.getId(),
                    e);
            return false;
        }
    }

    private Command prepareCommand(CommandTemplate template, SagaInstance saga) {
        return template.create(saga.getData()).toBuilder()
                .id(idGenerator.get())
                .correlationId(saga.getCorrelationId())
                .causationId(saga.getId())
                .timestamp(clock.instant())
                .build();
    }

    private void stepSucceeded(SagaInstance saga, SagaDefinition definition, SagaStep step) {
        timeoutManager.clearStepTimeout(saga.getId(), step.getId());
        forgetCommand(saga);
        saga.stepCompleted(step.getId(), clock.instant());
        repository.save(saga);
        logger.debug("Step {} of saga {} completed", step.getId(), saga.getId());
        notifyListeners(saga, l -> l.stepCompleted(saga.copy(), step.getId()));
        followTransition(saga, definition, step.getOnSuccess());
    }

    private void handleStepFailure(SagaInstance saga, SagaDefinition definition, SagaStep step, Throwable cause) {
        timeoutManager.clearStepTimeout(saga.getId(), step.getId());
        forgetCommand(saga);
        RetryPolicy policy = definition.retryPolicyOf(step);
        if (policy != null && policy.canRetry(saga.getRetryCount())) {
            int attempt = saga.incrementRetries();
            long delay = policy.delayFor(attempt);
            repository.save(saga);
            logger.warn("Step {} of saga {} failed, retry {} of {} in {}ms: {}", step.getId(), saga.getId(), attempt,
                    policy.getMaxAttempts(), delay, cause.getMessage());
            scheduler.schedule(() -> retryStep(saga.getId(), step.getId(), attempt), delay, TimeUnit.MILLISECONDS);
            return;
        }
        if (step.getOnFailure() != null) {
            logger.warn("Step {} of saga {} failed, following {}: {}", step.getId(), saga.getId(),
                    step.getOnFailure(), cause.getMessage());
            followTransition(saga, definition, step.getOnFailure());
            return;
        }
        saga.failed(cause.getMessage());
        saga.status(SagaStatus.FAILED, clock.instant());
        repository.save(saga);
        timeoutManager.clearTimeout(saga.getId());
        instances.remove(saga.getId());
        logger.error("Saga {} failed at step {}", saga.getId(), step.getId(), cause);
        notifyListeners(saga, l -> l.sagaFailed(saga.copy(), cause));
    }

    private void retryStep(String sagaId, String stepId, int attempt) {
        synchronized (lock) {
            SagaInstance saga = instances.get(sagaId);
            if (saga == null || !saga.getStatus().isExecuting() || !stepId.equals(saga.getCurrentStep())
                    || saga.getRetryCount() != attempt) {
                return;
            }
            logger.info("Retrying step {} of saga {}, attempt {}", stepId, sagaId, attempt);
            executeStep(saga, definition(saga.getSagaType()));
        }
    }

    private void followTransition(SagaInstance saga, SagaDefinition definition, StepTransition transition) {
        if (transition == null || transition.isEndSaga()) {
            complete(saga);
        } else if (transition.isCompensate()) {
            compensate(saga, definition);
        } else {
            saga.moveTo(transition.getNextStep(), clock.instant());
            repository.save(saga);
            executeStep(saga, definition);
        }
    }

    private void complete(SagaInstance saga) {
        saga.status(SagaStatus.COMPLETED, clock.instant());
        repository.save(saga);
        timeoutManager.clearTimeout(saga.getId());
        instances.remove(saga.getId());
        logger.info("Saga {} completed", saga.getId());
        notifyListeners(saga, l -> l.sagaCompleted(saga.copy()));
    }

    private void compensate(SagaInstance saga, SagaDefinition definition) {
        timeoutManager.clearTimeout(saga.getId());
        forgetCommand(saga);
        saga.status(SagaStatus.COMPENSATING, clock.instant());
        repository.save(saga);

        List<SagaStep> executed = new ArrayList<>();
        for (String stepId : saga.getCompletedSteps()) {
            definition.getStep(stepId).ifPresent(executed::add);
        }
        logger.info("Compensating {} steps of saga {} ({})", executed.size(), saga.getId(),
                definition.getCompensationStrategy());

        if (definition.getCompensationStrategy() == CompensationStrategy.PARALLEL) {
            List<CompletableFuture<Boolean>> sends = new ArrayList<>();
            for (SagaStep step : executed) {
                sends.add(CompletableFuture.supplyAsync(() -> sendCompensation(saga, step), scheduler));
            }
            CompletableFuture.allOf(sends.toArray(new CompletableFuture[0])).whenComplete((r, t) -> {
                int failures = 0;
                for (CompletableFuture<Boolean> send : sends) {
                    if (!send.join()) {
                        failures++;
                    }
                }
                synchronized (lock) {
                    finishCompensation(saga, failures);
                }
            });
        } else {
            Collections.reverse(executed);
            int failures = 0;
            for (SagaStep step : executed) {
                if (!sendCompensation(saga, step)) {
                    failures++;
                }
            }
            finishCompensation(saga, failures);
        }
    }

    private boolean sendCompensation(SagaInstance saga, SagaStep step) {
        if (!step.getCompensation().isPresent()) {
            return true;
        }
        try {
            Command command = prepareCommand(step.getCompensation().get(), saga);
            commandSender.send(command);
            logger.debug("Compensation {} of step {} of saga {} sent", command.getCommandType(), step.getId(),
                    saga.getId());
            return true;
        } catch (Exception e) {
            logger.error("Compensation of step {} of saga {} failed", step.getId(), saga.getId(), e);
            return false;
        }
    }

    private void finishCompensation(SagaInstance saga, int failures) {
        if (failures == 0) {
            saga.status(SagaStatus.COMPENSATED, clock.instant());
            logger.info("Saga {} compensated", saga.getId());
        } else {
            saga.failed(failures + " compensation(s) failed");
            saga.status(SagaStatus.COMPENSATION_PARTIAL, clock.instant());
            logger.warn("Saga {} partially compensated, {} compensation(s) failed", saga.getId(), failures);
        }
        repository.save(saga);
        instances.remove(saga.getId());
        notifyListeners(saga, l -> l.sagaCompensated(saga.copy()));
    }

    private void onSagaTimeout(String sagaId) {
        synchronized (lock) {
            SagaInstance saga = live(sagaId, SagaStatus::isExecuting);
            if (saga == null || !saga.getStatus().isExecuting()) {
                return;
            }
            forgetCommand(saga);
            timeoutManager.clearTimeout(sagaId);
            saga.failed("Saga timed out");
            saga.status(SagaStatus.TIMEOUT, clock.instant());
            repository.save(saga);
            notifyListeners(saga, l -> l.sagaTimedOut(saga.copy()));
            if (!saga.getCompletedSteps().isEmpty()) {
                compensate(saga, definition(saga.getSagaType()));
            } else {
                instances.remove(sagaId);
            }
        }
    }

    private void onStepTimeout(String sagaId, String stepId) {
        synchronized (lock) {
            SagaInstance saga = instances.get(sagaId);
            if (saga == null || !saga.getStatus().isExecuting() || !stepId.equals(saga.getCurrentStep())
                    || saga.getCurrentCommandId() == null) {
                return;
            }
            SagaDefinition definition = definition(saga.getSagaType());
            Optional<SagaStep> step = definition.getStep(stepId);
            if (step.isPresent()) {
                handleStepFailure(saga, definition, step.get(), SagaException.stepFailed(stepId, "timed out"));
            }
        }
    }

    private void forgetCommand(SagaInstance saga) {
        if (saga.getCurrentCommandId() != null) {
            pendingCommands.remove(saga.getCurrentCommandId());
            saga.commandSent(null);
        }
    }

    private void notifyListeners(SagaInstance saga, Consumer<SagaListener> notification) {
        for (SagaListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Saga listener {} failed on saga {}", listener, saga.getId(), e);
            }
        }
    }

    private static Map<String, Object> summary(DomainEvent event) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", event.getEventType());
        summary.put("data", event.getEventData());
        summary.put("timestamp", event.getTimestamp());
        return summary;
    }

    private static Map<String, Object> summary(Command command) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", command.getId());
        summary.put("commandType", command.getCommandType());
        summary.put("aggregateId", command.getAggregateId());
        return summary;
    }
}
