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

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Single edge of versioning graph. Transforms an event of {@code fromVersion} into {@code toVersion}, provided the
 * optional validator accepts the event first.
 */
public final class VersionRule {
    private final String fromVersion;
    private final String toVersion;
    private final UnaryOperator<DomainEvent> transform;
    private final Predicate<DomainEvent> validator;
    private final String description;

    public VersionRule(String fromVersion, String toVersion, UnaryOperator<DomainEvent> transform) {
        this(fromVersion, toVersion, transform, null, null);
    }

    public VersionRule(String fromVersion, String toVersion, UnaryOperator<DomainEvent> transform,
            Predicate<DomainEvent> validator, String description) {
        this.fromVersion = Objects.requireNonNull(fromVersion, "fromVersion");
        this.toVersion = Objects.requireNonNull(toVersion, "toVersion");
        this.transform = Objects.requireNonNull(transform, "transform");
        this.validator = validator;
        this.description = description;
    }

    public String getFromVersion() {
        return fromVersion;
    }

    public String getToVersion() {
        return toVersion;
    }

    public UnaryOperator<DomainEvent> getTransform() {
        return transform;
    }

    public Predicate<DomainEvent> getValidator() {
        return validator;
    }

    public String getDescription() {
        return description;
    }

    boolean accepts(DomainEvent event) {
        return validator == null || validator.test(event);
    }

    @Override
    public String toString() {
        return fromVersion + " -> " + toVersion + (description == null ? "" : " (" + description + ")");
    }
}
