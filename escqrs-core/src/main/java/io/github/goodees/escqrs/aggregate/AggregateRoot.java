package io.github.goodees.escqrs.aggregate;

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
import io.github.goodees.escqrs.event.EventMetadata;
import io.github.goodees.escqrs.matching.EventHandlers;
import io.github.goodees.escqrs.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

import static java.lang.Math.max;

/**
 * A single event sourced aggregate. The aggregate's state can <strong>only</strong> change as result of applying an
 * event, either one from its history ({@link #loadFromHistory(Iterable)}) or a new one it raises itself
 * ({@link #raiseEvent(String, Map)}), with exception of restoring a snapshot.
 *
 * <p>Subclasses declare how each event type changes the state in {@link #registerHandlers(EventHandlers.Builder)}.
 * An event of type nobody registered is skipped with a warning, so that an older deployment can replay streams
 * written by a newer one.
 *
 * <p>Raised events are kept in an uncommitted buffer until a {@link AggregateRepository} confirms they were
 * persisted. The aggregate has no persistence identity of its own; the event log is the only source of truth.
 */
public abstract class AggregateRoot {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final String id;
    private long version;
    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();
    private EventHandlers handlers;
    private boolean replaying;
    private Clock clock = Clock.systemUTC();
    private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

    protected AggregateRoot(String id) {
        this.id = Objects.requireNonNull(id, "Aggregate id must be set");
    }

    public final String getId() {
        return id;
    }

    /**
     * Version of the aggregate: the version of last event applied to it.
     * @return current version, 0 for aggregate without events
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Type of the aggregate, that together with id identifies its stream.
     * @return aggregate type, simple class name by default
     */
    public String getAggregateType() {
        return getClass().getSimpleName();
    }

    /**
     * Declare mutators of the aggregate state, one per event type. Called once, before first event is applied.
     * @param handlers builder to register with
     */
    protected abstract void registerHandlers(EventHandlers.Builder handlers);

    /**
     * Hook called after a newly raised event was applied. Not called during replay of history, so this is the place
     * for side effects that should happen only once.
     * @param event the raised event
     */
    protected void onEventRaised(DomainEvent event) {
    }

    /**
     * Whether the aggregate is currently replaying its history.
     * @return true during {@link #loadFromHistory(Iterable)}
     */
    protected final boolean isReplaying() {
        return replaying;
    }

    protected final DomainEvent raiseEvent(String eventType, Map<String, Object> data) {
        return raiseEvent(eventType, data, null);
    }

    /**
     * Create new event, apply it and add it to uncommitted events.
     * @param eventType type of the event
     * @param data payload
     * @param metadataOverrides metadata that take precedence over defaults, may be null
     * @return the raised event
     */
    protected final DomainEvent raiseEvent(String eventType, Map<String, Object> data,
            EventMetadata metadataOverrides) {
        EventMetadata defaults = EventMetadata.builder().version(EventMetadata.DEFAULT_SCHEMA_VERSION)
                .source(getClass().getSimpleName()).contentType(EventMetadata.DEFAULT_CONTENT_TYPE)
                .serialization(EventMetadata.DEFAULT_SERIALIZATION).correlationId(idGenerator.get()).build();
        DomainEvent event = DomainEvent.builder().id(idGenerator.get()).aggregateId(id)
                .aggregateType(getAggregateType()).version(version + 1).eventType(eventType).eventData(data)
                .metadata(defaults.merge(metadataOverrides)).timestamp(clock.instant()).build();
        applyEvent(event);
        uncommittedEvents.add(event);
        version = event.getVersion();
        onEventRaised(event);
        return event;
    }

    /**
     * Rebuild state from past events. Events must come in ascending version order, they are not reordered.
     * @param events history of the aggregate
     */
    public final void loadFromHistory(Iterable<DomainEvent> events) {
        replaying = true;
        try {
            for (DomainEvent event : events) {
                applyEvent(event);
                version = max(version, event.getVersion());
            }
        } finally {
            replaying = false;
        }
    }

    private void applyEvent(DomainEvent event) {
        if (handlers == null) {
            EventHandlers.Builder builder = EventHandlers.builder();
            registerHandlers(builder);
            handlers = builder.otherwise(this::unhandledEvent).build();
        }
        handlers.apply(event);
    }

    private void unhandledEvent(DomainEvent event) {
        logger.warn("No handler for event type {} in aggregate {} {}, event {} skipped", event.getEventType(),
                getAggregateType(), id, event.getVersion());
    }

    public final List<DomainEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Called by repository after uncommitted events were persisted.
     */
    public final void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    /**
     * Drop uncommitted events without persisting them. The state already reflects them, so the aggregate should be
     * reloaded before further use.
     */
    final void discardUncommittedEvents() {
        logger.debug("Discarding {} uncommitted events of {}", uncommittedEvents.size(), this);
        uncommittedEvents.clear();
    }

    /**
     * State of the aggregate for a snapshot. Contains identity and version, extended by
     * {@link #snapshotState()}.
     * @return JSON serializable state
     */
    public final Map<String, Object> createSnapshot() {
        Map<String, Object> state = new LinkedHashMap<>(snapshotState());
        state.put("id", id);
        state.put("version", version);
        return state;
    }

    /**
     * Restore the aggregate from a snapshot. When {@link #restoreState(Map)} refuses the state, the aggregate is left
     * untouched and the caller should replay the entire history instead.
     * @param snapshot the snapshot
     * @return true if state was restored
     */
    public final boolean restoreFromSnapshot(Snapshot snapshot) {
        if (!id.equals(snapshot.getAggregateId())) {
            throw new IllegalArgumentException("Snapshot of " + snapshot.getAggregateId() + " cannot restore " + id);
        }
        if (!restoreState(snapshot.getData())) {
            return false;
        }
        version = snapshot.getVersion();
        return true;
    }

    /**
     * Aggregate specific part of the snapshot. Values need to be serializable to JSON.
     * @return state, empty by default
     */
    protected Map<String, Object> snapshotState() {
        return Collections.emptyMap();
    }

    /**
     * Initialize the state from snapshot data. Since the state representation changes over time, the aggregate may
     * receive data in a shape it no longer understands, and should then return false.
     * @param state data as produced by {@link #snapshotState()}, after being serialized and deserialized
     * @return true if state was restored; by default false, which causes full replay
     */
    protected boolean restoreState(Map<String, Object> state) {
        return false;
    }

    /**
     * Replace clock used for event timestamps.
     * @param clock the clock
     */
    public final void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Replace generator of event and correlation ids.
     * @param idGenerator the generator
     */
    public final void setIdGenerator(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator);
    }

    @Override
    public String toString() {
        return getAggregateType() + "{" + id + "@" + version + ", uncommitted=" + uncommittedEvents.size() + '}';
    }
}
