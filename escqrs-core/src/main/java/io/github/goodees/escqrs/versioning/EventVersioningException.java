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

/**
 * Event cannot be brought to requested schema version, either because there is no chain of rules between the two
 * versions, or a rule on the chain rejected the event. This is a configuration error, never a transient one.
 */
public class EventVersioningException extends RuntimeException {
    private final String eventType;
    private final String fromVersion;
    private final String toVersion;

    public EventVersioningException(String message, String eventType, String fromVersion, String toVersion) {
        this(message, eventType, fromVersion, toVersion, null);
    }

    public EventVersioningException(String message, String eventType, String fromVersion, String toVersion,
            Throwable cause) {
        super(message, cause);
        this.eventType = eventType;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    static EventVersioningException noPath(String direction, String eventType, String from, String to) {
        return new EventVersioningException("No " + direction + " path found for " + eventType + " from version "
                + from + " to " + to, eventType, from, to);
    }

    static EventVersioningException validationFailed(String eventType, VersionRule rule) {
        return new EventVersioningException("Validation failed for " + eventType + " transformation from "
                + rule.getFromVersion() + " to " + rule.getToVersion(), eventType, rule.getFromVersion(),
                rule.getToVersion());
    }

    static EventVersioningException transformFailed(String eventType, VersionRule rule, RuntimeException cause) {
        return new EventVersioningException("Transformation of " + eventType + " from " + rule.getFromVersion()
                + " to " + rule.getToVersion() + " failed: " + cause.getMessage(), eventType, rule.getFromVersion(),
                rule.getToVersion(), cause);
    }

    public String getEventType() {
        return eventType;
    }

    public String getFromVersion() {
        return fromVersion;
    }

    public String getToVersion() {
        return toVersion;
    }
}
