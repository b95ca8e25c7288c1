package io.github.goodees.escqrs.event;

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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Criteria for selecting events. Every criterion that is not set matches any event, so {@link #all()} matches
 * everything.
 */
public final class EventFilter {
    private static final EventFilter ALL = builder().build();

    private final Set<String> eventTypes;
    private final Set<String> aggregateTypes;
    private final Set<String> aggregateIds;
    private final Instant from;
    private final Instant to;

    private EventFilter(Builder b) {
        this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.eventTypes));
        this.aggregateTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.aggregateTypes));
        this.aggregateIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.aggregateIds));
        this.from = b.from;
        this.to = b.to;
    }

    public static EventFilter all() {
        return ALL;
    }

    public Set<String> getEventTypes() {
        return eventTypes;
    }

    public Set<String> getAggregateTypes() {
        return aggregateTypes;
    }

    public Set<String> getAggregateIds() {
        return aggregateIds;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public boolean matches(DomainEvent event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getEventType())) {
            return false;
        }
        if (!aggregateTypes.isEmpty() && !aggregateTypes.contains(event.getAggregateType())) {
            return false;
        }
        if (!aggregateIds.isEmpty() && !aggregateIds.contains(event.getAggregateId())) {
            return false;
        }
        if (from != null && event.getTimestamp().isBefore(from)) {
            return false;
        }
        return to == null || !event.getTimestamp().isAfter(to);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EventFilter{eventTypes=" + eventTypes + ", aggregateTypes=" + aggregateTypes + ", aggregateIds="
                + aggregateIds + ", from=" + from + ", to=" + to + '}';
    }

    public static class Builder {
        private final Set<String> eventTypes = new LinkedHashSet<>();
        private final Set<String> aggregateTypes = new LinkedHashSet<>();
        private final Set<String> aggregateIds = new LinkedHashSet<>();
        private Instant from;
        private Instant to;

        private Builder() {
        }

        public Builder eventTypes(String... types) {
            Collections.addAll(eventTypes, types);
            return this;
        }

        public Builder aggregateTypes(String... types) {
            Collections.addAll(aggregateTypes, types);
            return this;
        }

        public Builder aggregateIds(Collection<String> ids) {
            aggregateIds.addAll(ids);
            return this;
        }

        public Builder aggregateIds(String... ids) {
            Collections.addAll(aggregateIds, ids);
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(this);
        }
    }
}
