package io.github.goodees.escqrs.projection;

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
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Folds events of the log into a read model.
 *
 * <p>On start the projection subscribes to the event store, catches up from its last checkpoint and then processes
 * live events. Live events delivered while catching up are buffered and processed afterwards, in order of position.
 * Events at or below the position reached by catching up were already read from the log and are skipped, so every
 * event is folded once. Live events of concurrent commits may arrive out of position order, each of them is folded
 * and the checkpoint keeps the highest position.</p>
 *
 * <p>Failed events are retried in place after {@link ProjectionOptions#getRetryDelay()}. Once the number of errors
 * reaches {@link ProjectionOptions#getRetryAttempts()}, the projection stops and the failure is rethrown as
 * {@link ProjectionException}.</p>
 */
public abstract class Projection {
    private static final double MAX_ERROR_RATE = 0.1;
    private static final Duration MAX_LAG = Duration.ofMinutes(5);

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final EventStore eventStore;
    protected final CheckpointStore checkpointStore;
    protected final ProjectionOptions options;
    protected final Clock clock;

    private volatile boolean running;
    private boolean initialized;
    private boolean catchingUp;
    private final List<RecordedEvent> liveBuffer = new ArrayList<>();
    private String subscriptionId;

    private long lastPosition;
    private long caughtUpPosition;
    private Instant lastEventTimestamp;
    private long eventsProcessed;
    private int errorCount;
    private Throwable lastError;
    private Instant startTime;

    protected Projection(EventStore eventStore, CheckpointStore checkpointStore, ProjectionOptions options) {
        this(eventStore, checkpointStore, options, Clock.systemUTC());
    }

    protected Projection(EventStore eventStore, CheckpointStore checkpointStore, ProjectionOptions options,
            Clock clock) {
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.options = options;
        this.clock = clock;
    }

    /**
     * Unique name, also the key of the checkpoint.
     */
    public abstract String getName();

    public abstract boolean canHandle(DomainEvent event);

    /**
     * Fold the event into the read model.
     * @param event event with its position in the log
     * @throws Exception when the event could not be processed; it will be retried
     */
    protected abstract void handle(RecordedEvent event) throws Exception;

    /**
     * Prepare the read model before first use.
     */
    protected void initializeProjection() throws Exception {
    }

    /**
     * Drop all state of the read model.
     */
    protected void resetProjection() throws Exception {
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            initializeProjection();
        } catch (Exception e) {
            throw ProjectionException.lifecycleFailed(getName(), "initialize", e);
        }
        Optional<Checkpoint> checkpoint = checkpointStore.load(getName());
        lastPosition = checkpoint.map(Checkpoint::getPosition).orElse(0L);
        caughtUpPosition = lastPosition;
        initialized = true;
        logger.info("Projection {} initialized at position {}", getName(), lastPosition);
    }

    /**
     * Subscribe to live events and catch up from last checkpoint.
     */
    public void start() {
        synchronized (this) {
            initialize();
            if (running) {
                return;
            }
            running = true;
            catchingUp = true;
            caughtUpPosition = lastPosition;
            startTime = clock.instant();
            subscriptionId = eventStore.subscribe(options.getSubscriptionFilter(), this::onLiveEvent);
        }
        try {
            catchUp();
        } finally {
            drainLiveBuffer();
        }
        logger.info("Projection {} started at position {}", getName(), lastPosition);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        catchingUp = false;
        liveBuffer.clear();
        if (subscriptionId != null) {
            eventStore.unsubscribe(subscriptionId);
            subscriptionId = null;
        }
        saveCheckpoint();
        logger.info("Projection {} stopped at position {}", getName(), lastPosition);
    }

    /**
     * Drop read model, checkpoint and counters. A running projection is restarted and catches up from the start.
     */
    public void reset() {
        boolean wasRunning;
        synchronized (this) {
            wasRunning = running;
            stop();
            try {
                resetProjection();
            } catch (Exception e) {
                throw ProjectionException.lifecycleFailed(getName(), "reset", e);
            }
            checkpointStore.delete(getName());
            lastPosition = 0;
            caughtUpPosition = 0;
            lastEventTimestamp = null;
            eventsProcessed = 0;
            errorCount = 0;
            lastError = null;
            logger.info("Projection {} reset", getName());
        }
        if (wasRunning) {
            start();
        }
    }

    /**
     * Reset and replay the whole log, saving a checkpoint after each batch.
     */
    public void rebuild() {
        reset();
        start();
        logger.info("Projection {} rebuilt, {} events processed", getName(), eventsProcessed);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Process single event. Events at or below the position reached by catching up are skipped.
     * @throws ProjectionException when the event keeps failing and the projection stopped
     */
    public synchronized void processEvent(RecordedEvent event) {
        if (event.getPosition() <= caughtUpPosition) {
            return;
        }
        fold(event);
    }

    private void fold(RecordedEvent event) {
        if (!canHandle(event.getEvent())) {
            advanceTo(event.getPosition());
            return;
        }
        while (true) {
            long start = clock.millis();
            try {
                handle(event);
                eventsProcessed++;
                advanceTo(event.getPosition());
                lastEventTimestamp = event.getEvent().getTimestamp();
                if (eventsProcessed % options.getCheckpointInterval() == 0) {
                    saveCheckpoint();
                }
                logger.debug("Projection {} processed {} at {} in {}ms", getName(), event.getEvent().getEventType(),
                        event.getPosition(), clock.millis() - start);
                return;
            } catch (Exception e) {
                errorCount++;
                lastError = e;
                logger.error("Projection {} failed to process {} at {}", getName(), event.getEvent().getEventType(),
                        event.getPosition(), e);
                if (errorCount >= options.getRetryAttempts()) {
                    logger.error("Projection {} stops after {} errors", getName(), errorCount);
                    stop();
                    throw ProjectionException.stopped(getName(), event.getPosition(), errorCount, e);
                }
                pause();
            }
        }
    }

    private void advanceTo(long position) {
        lastPosition = Math.max(lastPosition, position);
    }

    private synchronized void processCaughtUp(RecordedEvent event) {
        if (event.getPosition() <= caughtUpPosition) {
            return;
        }
        fold(event);
        caughtUpPosition = event.getPosition();
    }

    private void pause() {
        try {
            Thread.sleep(options.getRetryDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProjectionException.lifecycleFailed(getName(), "retry", e);
        }
    }

    private void onLiveEvent(RecordedEvent event) {
        synchronized (this) {
            if (!running) {
                return;
            }
            if (catchingUp) {
                liveBuffer.add(event);
                return;
            }
        }
        processEvent(event);
    }

    private void catchUp() {
        long position;
        synchronized (this) {
            position = caughtUpPosition;
        }
        while (running) {
            List<RecordedEvent> batch;
            try {
                batch = eventStore.getAllEvents(options.getSubscriptionFilter(), position, options.getBufferSize());
            } catch (EventStoreException e) {
                stop();
                throw ProjectionException.lifecycleFailed(getName(), "read events for", e);
            }
            if (batch.isEmpty()) {
                break;
            }
            for (RecordedEvent event : batch) {
                if (!running) {
                    break;
                }
                processCaughtUp(event);
                position = event.getPosition();
            }
            saveCheckpoint();
            logger.debug("Projection {} caught up {} events to position {}", getName(), batch.size(), position);
        }
    }

    private synchronized void drainLiveBuffer() {
        catchingUp = false;
        List<RecordedEvent> buffered = new ArrayList<>(liveBuffer);
        liveBuffer.clear();
        buffered.sort(Comparator.comparingLong(RecordedEvent::getPosition));
        for (RecordedEvent event : buffered) {
            if (!running) {
                return;
            }
            processEvent(event);
        }
    }

    protected synchronized void saveCheckpoint() {
        if (lastPosition == 0) {
            return;
        }
        checkpointStore.save(Checkpoint.of(getName(), lastPosition, clock.instant()));
        logger.debug("Projection {} checkpoint at {}", getName(), lastPosition);
    }

    public synchronized boolean isHealthy() {
        double errorRate = (double) errorCount / Math.max(eventsProcessed, 1);
        return errorRate < MAX_ERROR_RATE && lag() < MAX_LAG.toMillis();
    }

    private long lag() {
        if (eventsProcessed == 0 || lastEventTimestamp == null) {
            return 0;
        }
        return Math.max(0, clock.millis() - lastEventTimestamp.toEpochMilli());
    }

    private double processingRate() {
        if (startTime == null) {
            return 0;
        }
        long elapsed = clock.millis() - startTime.toEpochMilli();
        return elapsed <= 0 ? 0 : eventsProcessed * 1000.0 / elapsed;
    }

    public synchronized ProjectionStats getStats() {
        Optional<String> error = Optional.ofNullable(lastError).map(e -> String.valueOf(e.getMessage()));
        return ImmutableProjectionStats.builder()
                .name(getName())
                .lastPosition(lastPosition)
                .eventsProcessed(eventsProcessed)
                .errorCount(errorCount)
                .lastError(error)
                .processingRate(processingRate())
                .lag(lag())
                .healthy(isHealthy())
                .running(running)
                .build();
    }

    public synchronized long getLastPosition() {
        return lastPosition;
    }

    public synchronized Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError);
    }
}
