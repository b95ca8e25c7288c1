package io.github.goodees.escqrs.versioning;

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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Fluent definition of {@link EventVersioning}.
 * <pre>
 * EventVersioning v = EventVersioningBuilder.forEventType("OrderPlaced")
 *         .currentVersion("2.0")
 *         .upcast("1.0", "2.0", VersionTransformations.addField("currency", "EUR"))
 *         .downcast("2.0", "1.0", VersionTransformations.removeField("currency"))
 *         .build();
 * </pre>
 */
public class EventVersioningBuilder {
    private final String eventType;
    private String currentVersion;
    private final List<VersionRule> upcastRules = new ArrayList<>();
    private final List<VersionRule> downcastRules = new ArrayList<>();

    private EventVersioningBuilder(String eventType) {
        this.eventType = eventType;
    }

    public static EventVersioningBuilder forEventType(String eventType) {
        return new EventVersioningBuilder(eventType);
    }

    public EventVersioningBuilder currentVersion(String version) {
        this.currentVersion = version;
        return this;
    }

    public EventVersioningBuilder upcast(String from, String to, UnaryOperator<DomainEvent> transform) {
        return upcast(from, to, transform, null);
    }

    public EventVersioningBuilder upcast(String from, String to, UnaryOperator<DomainEvent> transform,
            Predicate<DomainEvent> validator) {
        if (EventVersionManager.compareVersions(from, to) >= 0) {
            throw new IllegalArgumentException("Upcast of " + eventType + " must go to newer version: " + from
                    + " -> " + to);
        }
        upcastRules.add(new VersionRule(from, to, transform, validator, "upcast " + eventType));
        return this;
    }

    public EventVersioningBuilder downcast(String from, String to, UnaryOperator<DomainEvent> transform) {
        return downcast(from, to, transform, null);
    }

    public EventVersioningBuilder downcast(String from, String to, UnaryOperator<DomainEvent> transform,
            Predicate<DomainEvent> validator) {
        if (EventVersionManager.compareVersions(from, to) <= 0) {
            throw new IllegalArgumentException("Downcast of " + eventType + " must go to older version: " + from
                    + " -> " + to);
        }
        downcastRules.add(new VersionRule(from, to, transform, validator, "downcast " + eventType));
        return this;
    }

    public EventVersioning build() {
        if (currentVersion == null) {
            throw new IllegalStateException("Current version of " + eventType + " is not set");
        }
        return new EventVersioning(eventType, currentVersion, upcastRules, downcastRules);
    }
}
