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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Versioning rules of single event type: the schema version the application works with, and the rules to reach it
 * from older ({@linkplain #getUpcastRules() upcast}) and newer ({@linkplain #getDowncastRules() downcast}) versions.
 */
public final class EventVersioning {
    private final String eventType;
    private final String version;
    private final List<VersionRule> upcastRules;
    private final List<VersionRule> downcastRules;

    public EventVersioning(String eventType, String version, List<VersionRule> upcastRules,
            List<VersionRule> downcastRules) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.version = Objects.requireNonNull(version, "version");
        this.upcastRules = Collections.unmodifiableList(new ArrayList<>(upcastRules));
        this.downcastRules = Collections.unmodifiableList(new ArrayList<>(downcastRules));
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * Target schema version of events of this type.
     * @return current version
     */
    public String getVersion() {
        return version;
    }

    public List<VersionRule> getUpcastRules() {
        return upcastRules;
    }

    public List<VersionRule> getDowncastRules() {
        return downcastRules;
    }
}
