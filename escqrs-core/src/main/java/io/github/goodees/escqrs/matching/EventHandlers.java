package io.github.goodees.escqrs.matching;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Dispatch table from event type to the function applying it. The set of known event types is closed when the table
 * is built, every other type falls into the single {@linkplain Builder#otherwise(Consumer) unhandled branch}.
 * <p>Contrary to class based type switch, events are matched by their {@linkplain DomainEvent#getEventType() type
 * tag}, as the payload is not bound to a Java class.
 */
public class EventHandlers {

    public enum Dispatch {
        HANDLED, UNHANDLED
    }

    private final Map<String, Branch> branches;
    private final Consumer<DomainEvent> unhandled;

    private EventHandlers(Builder b) {
        this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(b.branches));
        this.unhandled = b.unhandled;
    }

    /**
     * Execute the branch registered for type of the event.
     * @param event event to dispatch
     * @return {@link Dispatch#HANDLED} when a branch accepted the event, otherwise the unhandled branch was invoked
     */
    public Dispatch apply(DomainEvent event) {
        Branch branch = branches.get(event.getEventType());
        if (branch != null && branch.matches(event)) {
            branch.callback.accept(event);
            return Dispatch.HANDLED;
        }
        unhandled.accept(event);
        return Dispatch.UNHANDLED;
    }

    public boolean handles(String eventType) {
        return branches.containsKey(eventType);
    }

    public Set<String> knownTypes() {
        return branches.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final Map<String, Branch> branches = new LinkedHashMap<>();
        private Consumer<DomainEvent> unhandled = e -> {
        };

        private Builder() {
        }

        public Builder on(String eventType, Consumer<DomainEvent> callback) {
            return on(eventType, null, callback);
        }

        public Builder on(String eventType, Predicate<DomainEvent> check, Consumer<DomainEvent> callback) {
            if (branches.containsKey(eventType)) {
                throw new IllegalArgumentException("Handler for event type " + eventType + " already registered");
            }
            branches.put(eventType, new Branch(check, callback));
            return this;
        }

        public Builder otherwise(Consumer<DomainEvent> fallback) {
            this.unhandled = Objects.requireNonNull(fallback, "Fallback cannot be null");
            return this;
        }

        public EventHandlers build() {
            return new EventHandlers(this);
        }
    }

    private static class Branch {
        private final Predicate<DomainEvent> check;
        private final Consumer<DomainEvent> callback;

        Branch(Predicate<DomainEvent> check, Consumer<DomainEvent> callback) {
            this.check = check;
            this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
        }

        boolean matches(DomainEvent event) {
            return check == null || check.test(event);
        }
    }
}
