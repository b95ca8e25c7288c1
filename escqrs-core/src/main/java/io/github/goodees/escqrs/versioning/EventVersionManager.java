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
import io.github.goodees.escqrs.event.EventMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brings events to the schema version application code expects. Rules of every event type form two graphs, one for
 * upcasting and one for downcasting; conversion follows the shortest chain of rules between stored and target
 * version.
 * <p>Event types without registered versioning are passed through unchanged. Events without schema version in
 * metadata are considered to be of {@link EventMetadata#DEFAULT_SCHEMA_VERSION}.
 */
public class EventVersionManager {
    private static final Logger logger = LoggerFactory.getLogger(EventVersionManager.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * Register (or replace) versioning rules of an event type.
     * @param versioning the rules
     */
    public void registerVersioning(EventVersioning versioning) {
        Registration previous = registrations.put(versioning.getEventType(), new Registration(versioning));
        if (previous != null) {
            logger.info("Versioning of {} replaced, current version is now {}", versioning.getEventType(),
                    versioning.getVersion());
        }
    }

    public Optional<String> getTargetVersion(String eventType) {
        Registration r = registrations.get(eventType);
        return r == null ? Optional.empty() : Optional.of(r.versioning.getVersion());
    }

    /**
     * Convert the event to current version of its type.
     * @param event stored event
     * @return event in target version, or the same instance if it already is in target version or is not versioned
     * @throws EventVersioningException when no conversion path exists
     */
    public DomainEvent upgradeEvent(DomainEvent event) {
        Registration r = registrations.get(event.getEventType());
        if (r == null) {
            return event;
        }
        String target = r.versioning.getVersion();
        int cmp = compareVersions(storedVersion(event), target);
        if (cmp == 0) {
            return event;
        } else if (cmp < 0) {
            return upcastEvent(event, target);
        } else {
            return downcastEvent(event, target);
        }
    }

    public DomainEvent upcastEvent(DomainEvent event, String targetVersion) {
        return convert(event, targetVersion, true);
    }

    public DomainEvent downcastEvent(DomainEvent event, String targetVersion) {
        return convert(event, targetVersion, false);
    }

    /**
     * Check if conversion between versions of event type is possible.
     * @param eventType type of event
     * @param fromVersion stored version
     * @param toVersion requested version
     * @return true if versions are equal or path of rules exists in the right direction
     */
    public boolean canUpgrade(String eventType, String fromVersion, String toVersion) {
        int cmp = compareVersions(fromVersion, toVersion);
        if (cmp == 0) {
            return true;
        }
        Registration r = registrations.get(eventType);
        if (r == null) {
            return false;
        }
        return findPath(cmp < 0 ? r.upcastIndex : r.downcastIndex, fromVersion, toVersion) != null;
    }

    /**
     * All versions mentioned by rules of the type, ordered from oldest.
     * @param eventType type of event
     * @return versions, empty if the type has no versioning
     */
    public List<String> getSupportedVersions(String eventType) {
        Registration r = registrations.get(eventType);
        if (r == null) {
            return Collections.emptyList();
        }
        Set<String> versions = new TreeSet<>(EventVersionManager::compareVersions);
        versions.add(r.versioning.getVersion());
        for (VersionRule rule : r.versioning.getUpcastRules()) {
            versions.add(rule.getFromVersion());
            versions.add(rule.getToVersion());
        }
        for (VersionRule rule : r.versioning.getDowncastRules()) {
            versions.add(rule.getFromVersion());
            versions.add(rule.getToVersion());
        }
        return new ArrayList<>(versions);
    }

    private DomainEvent convert(DomainEvent event, String targetVersion, boolean upcast) {
        String eventType = event.getEventType();
        String from = storedVersion(event);
        if (compareVersions(from, targetVersion) == 0) {
            return event;
        }
        String direction = upcast ? "upcast" : "downcast";
        Registration r = registrations.get(eventType);
        if (r == null) {
            throw EventVersioningException.noPath(direction, eventType, from, targetVersion);
        }
        List<VersionRule> path = findPath(upcast ? r.upcastIndex : r.downcastIndex, from, targetVersion);
        if (path == null) {
            throw EventVersioningException.noPath(direction, eventType, from, targetVersion);
        }
        DomainEvent current = event;
        for (VersionRule rule : path) {
            if (!rule.accepts(current)) {
                throw EventVersioningException.validationFailed(eventType, rule);
            }
            try {
                current = rule.getTransform().apply(current);
            } catch (EventVersioningException e) {
                throw e;
            } catch (RuntimeException e) {
                throw EventVersioningException.transformFailed(eventType, rule, e);
            }
            current = current.withSchemaVersion(rule.getToVersion());
        }
        logger.debug("{} {} {} from {} to {} in {} steps", direction, eventType, event.getId(), from, targetVersion,
                path.size());
        return current;
    }

    /**
     * Breadth first search for the shortest chain of rules.
     */
    private static List<VersionRule> findPath(Map<String, List<VersionRule>> index, String from, String to) {
        Deque<PathNode> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(new PathNode(normalize(from), Collections.emptyList()));
        visited.add(normalize(from));
        while (!queue.isEmpty()) {
            PathNode node = queue.poll();
            for (VersionRule rule : index.getOrDefault(node.version, Collections.emptyList())) {
                String next = normalize(rule.getToVersion());
                if (!visited.add(next)) {
                    continue;
                }
                List<VersionRule> path = new ArrayList<>(node.path);
                path.add(rule);
                if (compareVersions(next, to) == 0) {
                    return path;
                }
                queue.add(new PathNode(next, path));
            }
        }
        return null;
    }

    private static String storedVersion(DomainEvent event) {
        String v = event.getSchemaVersion();
        return v == null ? EventMetadata.DEFAULT_SCHEMA_VERSION : v;
    }

    /**
     * Compare versions in dot notation component by component, numerically. Missing components count as zero, so
     * {@code "1" == "1.0"} and {@code "1.2" < "1.10"}.
     * @param a first version
     * @param b second version
     * @return negative, zero or positive when a is older, same or newer than b
     */
    public static int compareVersions(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            long l = i < left.length ? component(left[i], a) : 0;
            long r = i < right.length ? component(right[i], b) : 0;
            if (l != r) {
                return Long.compare(l, r);
            }
        }
        return 0;
    }

    private static long component(String part, String version) {
        if (part.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(part.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version " + version + " is not in numeric dot notation", e);
        }
    }

    /**
     * Canonical form of a version for graph lookups, so that "1" and "1.0" denote the same node.
     */
    private static String normalize(String version) {
        String[] parts = version.split("\\.");
        int last = parts.length - 1;
        while (last > 0 && component(parts[last], version) == 0) {
            last--;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= last; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(component(parts[i], version));
        }
        return sb.toString();
    }

    private static class PathNode {
        private final String version;
        private final List<VersionRule> path;

        PathNode(String version, List<VersionRule> path) {
            this.version = version;
            this.path = path;
        }
    }

    private static class Registration {
        private final EventVersioning versioning;
        private final Map<String, List<VersionRule>> upcastIndex = new ConcurrentHashMap<>();
        private final Map<String, List<VersionRule>> downcastIndex = new ConcurrentHashMap<>();

        Registration(EventVersioning versioning) {
            this.versioning = versioning;
            for (VersionRule rule : versioning.getUpcastRules()) {
                upcastIndex.computeIfAbsent(normalize(rule.getFromVersion()), k -> new ArrayList<>()).add(rule);
            }
            for (VersionRule rule : versioning.getDowncastRules()) {
                downcastIndex.computeIfAbsent(normalize(rule.getFromVersion()), k -> new ArrayList<>()).add(rule);
            }
        }
    }
}
