package io.github.goodees.escqrs.replay;

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
import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Replays the event log into {@link ReplayHandler handlers}. Each replay walks the log in position order in batches,
 * on a thread of supplied executor, and can be paused, resumed or cancelled while it runs. Events are applied one at
 * a time, so every handler sees each stream in version order.
 *
 * <p>Finished replays are kept, with their progress, until {@link #removeReplay(String)}.</p>
 */
public class EventReplay {
    /**
     * Maximal number of events counted for the estimate of replay size.
     */
    public static final int ESTIMATE_LIMIT = 1000;

    private static final Logger logger = LoggerFactory.getLogger(EventReplay.class);

    private final EventStore eventStore;
    private final Executor executor;
    private final Clock clock;
    private final Map<String, Run> replays = new ConcurrentHashMap<>();
    private final List<ReplayListener> listeners = new CopyOnWriteArrayList<>();

    public EventReplay(EventStore eventStore, Executor executor) {
        this(eventStore, executor, Clock.systemUTC());
    }

    public EventReplay(EventStore eventStore, Executor executor, Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore);
        this.executor = Objects.requireNonNull(executor);
        this.clock = Objects.requireNonNull(clock);
    }

    public void addListener(ReplayListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Start replay of matching events.
     * @param filter events to replay
     * @param handlers receivers of the events, each is offered every event in turn
     * @param options batching, range and error handling of the run
     * @return id of the replay
     * @throws EventStoreException when the size of the replay cannot be estimated
     */
    public String startReplay(EventFilter filter, List<ReplayHandler> handlers, ReplayOptions options)
            throws EventStoreException {
        Objects.requireNonNull(filter);
        Objects.requireNonNull(options);
        if (handlers.isEmpty()) {
            throw new IllegalArgumentException("Replay needs at least one handler");
        }
        long estimate = eventStore.getAllEvents(filter, options.getFromPosition(), ESTIMATE_LIMIT).stream()
                .filter(e -> e.getPosition() <= options.getToPosition())
                .count();
        Run run = new Run(UUID.randomUUID().toString(), filter, new ArrayList<>(handlers), options, estimate);
        replays.put(run.id, run);
        logger.info("Replay {} of {} started with {} handlers, about {} events", run.id, filter, handlers.size(),
                estimate);
        ReplayProgress started = run.progress();
        notifyListeners(run, l -> l.replayStarted(started));
        try {
            executor.execute(run::execute);
        } catch (RejectedExecutionException e) {
            replays.remove(run.id);
            throw e;
        }
        return run.id;
    }

    /**
     * Feed matching history into a single handler, typically a read model built for the first time.
     */
    public String replayToNewHandler(ReplayHandler handler, EventFilter filter, ReplayOptions options)
            throws EventStoreException {
        return startReplay(filter, Collections.singletonList(handler), options);
    }

    /**
     * @throws ReplayException when the replay does not exist or is not running
     */
    public void pauseReplay(String replayId) {
        find(replayId).pause();
    }

    /**
     * @throws ReplayException when the replay does not exist or is not paused
     */
    public void resumeReplay(String replayId) {
        find(replayId).resume();
    }

    /**
     * Cancel replay. The event being applied is finished first.
     * @return false when the replay had already finished
     * @throws ReplayException when the replay does not exist
     */
    public boolean cancelReplay(String replayId) {
        return find(replayId).finish(ReplayStatus.CANCELLED, null);
    }

    public Optional<ReplayProgress> getProgress(String replayId) {
        Run run = replays.get(replayId);
        return run == null ? Optional.empty() : Optional.of(run.progress());
    }

    /**
     * Progress of replays that are running or paused.
     */
    public List<ReplayProgress> getActiveReplays() {
        return replays.values().stream()
                .map(Run::progress)
                .filter(p -> p.getStatus().isActive())
                .collect(Collectors.toList());
    }

    /**
     * Completes with the final progress when the replay finishes, whatever its outcome.
     */
    public CompletableFuture<ReplayProgress> completion(String replayId) {
        return find(replayId).completion;
    }

    /**
     * Forget finished replay.
     * @throws ReplayException when the replay does not exist or is still active
     */
    public void removeReplay(String replayId) {
        Run run = find(replayId);
        ReplayStatus status = run.progress().getStatus();
        if (!status.isFinished()) {
            throw ReplayException.illegalState(replayId, "remove", status);
        }
        replays.remove(replayId);
    }

    /**
     * History of an aggregate up to given version, e.g. to inspect the state it had at that point.
     */
    public List<DomainEvent> getHistory(String aggregateId, String aggregateType, long upToVersion)
            throws EventStoreException {
        return eventStore.getEvents(aggregateId, aggregateType, 1, upToVersion);
    }

    /**
     * Check that events are the contiguous history of an aggregate, starting at version 1.
     */
    public static OrderValidation validateEventOrder(List<DomainEvent> events, String aggregateId) {
        ImmutableOrderValidation.Builder result = ImmutableOrderValidation.builder();
        long lastVersion = 0;
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.getAggregateId())) {
                result.addIssues("Event " + event.getId() + " belongs to different aggregate "
                        + event.getAggregateId());
                continue;
            }
            if (event.getVersion() != lastVersion + 1) {
                result.addIssues("Version gap detected: expected " + (lastVersion + 1) + ", got "
                        + event.getVersion());
            }
            lastVersion = event.getVersion();
        }
        return result.build();
    }

    private Run find(String replayId) {
        Run run = replays.get(replayId);
        if (run == null) {
            throw ReplayException.notFound(replayId);
        }
        return run;
    }

    private void notifyListeners(Run run, Consumer<ReplayListener> notification) {
        for (ReplayListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Replay listener {} failed on replay {}", listener, run.id, e);
            }
        }
    }

    private class Run {
        private final String id;
        private final EventFilter filter;
        private final List<ReplayHandler> handlers;
        private final ReplayOptions options;
        private final long estimatedTotal;
        private final Instant startTime = clock.instant();
        private final CompletableFuture<ReplayProgress> completion = new CompletableFuture<>();
        private final Map<String, Long> streamVersions = new HashMap<>();

        private ReplayStatus status = ReplayStatus.PENDING;
        private long processed;
        private long failed;
        private long skipped;
        private long currentPosition;
        private Instant endTime;
        private String failureReason;
        private final List<ReplayError> errors = new ArrayList<>();

        Run(String id, EventFilter filter, List<ReplayHandler> handlers, ReplayOptions options, long estimatedTotal) {
            this.id = id;
            this.filter = filter;
            this.handlers = handlers;
            this.options = options;
            this.estimatedTotal = estimatedTotal;
        }

        void execute() {
            synchronized (this) {
                if (status != ReplayStatus.PENDING) {
                    return;
                }
                status = ReplayStatus.RUNNING;
            }
            long position = options.getFromPosition();
            try {
                while (awaitRunnable()) {
                    List<RecordedEvent> batch = eventStore.getAllEvents(filter, position, options.getBatchSize());
                    boolean end = batch.size() < options.getBatchSize();
                    int count = 0;
                    for (RecordedEvent event : batch) {
                        if (event.getPosition() > options.getToPosition()) {
                            end = true;
                            break;
                        }
                        if (!awaitRunnable()) {
                            return;
                        }
                        replayEvent(event);
                        position = event.getPosition();
                        count++;
                    }
                    if (count > 0) {
                        ReplayProgress progress = progress();
                        int batchSize = count;
                        notifyListeners(this, l -> l.batchProcessed(progress, batchSize));
                        logger.debug("Replay {} processed {} events up to position {}", id, count, position);
                    }
                    if (end) {
                        finish(ReplayStatus.COMPLETED, null);
                        return;
                    }
                    rest();
                }
            } catch (EventStoreException e) {
                logger.error("Replay {} could not read events after position {}", id, position, e);
                finish(ReplayStatus.FAILED, e.getMessage());
            } catch (ReplayException e) {
                finish(ReplayStatus.FAILED, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Replay {} failed at position {}", id, position, e);
                finish(ReplayStatus.FAILED, e.toString());
                throw e;
            }
        }

        private void replayEvent(RecordedEvent recorded) {
            DomainEvent event = recorded.getEvent();
            if (options.getSkipEventTypes().contains(event.getEventType())) {
                synchronized (this) {
                    skipped++;
                    currentPosition = recorded.getPosition();
                }
                return;
            }
            if (options.isValidateOrder()) {
                Long previous = streamVersions.get(event.getStreamKey());
                if (previous != null && event.getVersion() <= previous) {
                    fail(recorded, "Version " + event.getVersion() + " of stream " + event.getStreamKey()
                            + " follows version " + previous, null);
                    return;
                }
                streamVersions.put(event.getStreamKey(), event.getVersion());
            }
            try {
                for (ReplayHandler handler : handlers) {
                    if (handler.canHandle(event)) {
                        handler.handle(recorded);
                    }
                }
            } catch (Exception e) {
                fail(recorded, e.getMessage() == null ? e.toString() : e.getMessage(), e);
                return;
            }
            synchronized (this) {
                processed++;
                currentPosition = recorded.getPosition();
            }
        }

        private void fail(RecordedEvent recorded, String message, Exception cause) {
            DomainEvent event = recorded.getEvent();
            ReplayError error = ImmutableReplayError.builder()
                    .eventId(event.getId())
                    .eventType(event.getEventType())
                    .aggregateId(event.getAggregateId())
                    .position(recorded.getPosition())
                    .message(message)
                    .timestamp(clock.instant())
                    .build();
            ReplayProgress progress;
            synchronized (this) {
                failed++;
                currentPosition = recorded.getPosition();
                errors.add(error);
                progress = progressLocked();
            }
            if (cause == null) {
                logger.error("Replay {} rejected event {} at position {}: {}", id, event.getId(),
                        recorded.getPosition(), message);
            } else {
                logger.error("Replay {} failed to apply event {} at position {}", id, event.getId(),
                        recorded.getPosition(), cause);
            }
            notifyListeners(this, l -> l.eventFailed(progress, error));
            if (options.isStopOnError()) {
                throw ReplayException.stopped(id, error, cause);
            }
        }

        /**
         * Blocks while paused.
         * @return whether the replay should go on
         */
        private boolean awaitRunnable() {
            synchronized (this) {
                try {
                    while (status == ReplayStatus.PAUSED) {
                        wait();
                    }
                    return status == ReplayStatus.RUNNING;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            interrupted();
            return false;
        }

        private void rest() {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(options.getDelayBetweenBatches());
            synchronized (this) {
                try {
                    long remaining;
                    while (status == ReplayStatus.RUNNING && (remaining = deadline - System.nanoTime()) > 0) {
                        TimeUnit.NANOSECONDS.timedWait(this, remaining);
                    }
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            interrupted();
        }

        private void interrupted() {
            logger.warn("Replay {} interrupted", id);
            finish(ReplayStatus.CANCELLED, "interrupted");
        }

        synchronized void pause() {
            if (status != ReplayStatus.RUNNING) {
                throw ReplayException.illegalState(id, "pause", status);
            }
            status = ReplayStatus.PAUSED;
            notifyAll();
            logger.info("Replay {} paused at position {}", id, currentPosition);
        }

        synchronized void resume() {
            if (status != ReplayStatus.PAUSED) {
                throw ReplayException.illegalState(id, "resume", status);
            }
            status = ReplayStatus.RUNNING;
            notifyAll();
            logger.info("Replay {} resumed at position {}", id, currentPosition);
        }

        boolean finish(ReplayStatus finalStatus, String reason) {
            ReplayProgress progress;
            synchronized (this) {
                if (status.isFinished()) {
                    return false;
                }
                status = finalStatus;
                endTime = clock.instant();
                failureReason = reason;
                notifyAll();
                progress = progressLocked();
            }
            logger.info("Replay {} {} with {} processed, {} failed, {} skipped events", id,
                    finalStatus.name().toLowerCase(), progress.getProcessedEvents(), progress.getFailedEvents(),
                    progress.getSkippedEvents());
            completion.complete(progress);
            notifyListeners(this, l -> l.replayFinished(progress));
            return true;
        }

        synchronized ReplayProgress progress() {
            return progressLocked();
        }

        private ReplayProgress progressLocked() {
            ImmutableReplayProgress.Builder progress = ImmutableReplayProgress.builder()
                    .replayId(id)
                    .estimatedTotal(estimatedTotal)
                    .processedEvents(processed)
                    .failedEvents(failed)
                    .skippedEvents(skipped)
                    .currentPosition(currentPosition)
                    .status(status)
                    .startTime(startTime)
                    .endTime(Optional.ofNullable(endTime))
                    .failureReason(Optional.ofNullable(failureReason))
                    .errors(errors);
            long done = processed + failed + skipped;
            if (status == ReplayStatus.RUNNING && done > 0 && estimatedTotal > done) {
                Instant now = clock.instant();
                long elapsed = Duration.between(startTime, now).toMillis();
                progress.estimatedCompletionTime(now.plusMillis(elapsed * (estimatedTotal - done) / done));
            }
            return progress.build();
        }
    }
}
