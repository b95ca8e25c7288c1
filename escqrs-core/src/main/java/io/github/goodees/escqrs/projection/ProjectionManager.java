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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registry of projections with bulk lifecycle operations.
 */
public class ProjectionManager {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionManager.class);

    private final Map<String, Projection> projections = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Register projection.
     * @throws IllegalArgumentException when a projection of the same name is registered
     */
    public void register(Projection projection) {
        String name = projection.getName();
        synchronized (projections) {
            if (projections.containsKey(name)) {
                throw new IllegalArgumentException("Projection already registered: " + name);
            }
            projections.put(name, projection);
        }
        logger.info("Projection {} registered", name);
    }

    /**
     * Remove stopped projection.
     * @return true if the projection was registered
     * @throws IllegalStateException when the projection is running
     */
    public boolean unregister(String name) {
        synchronized (projections) {
            Projection projection = projections.get(name);
            if (projection == null) {
                return false;
            }
            if (projection.isRunning()) {
                throw new IllegalStateException("Cannot unregister running projection: " + name);
            }
            projections.remove(name);
        }
        logger.info("Projection {} unregistered", name);
        return true;
    }

    public Optional<Projection> getProjection(String name) {
        return Optional.ofNullable(projections.get(name));
    }

    /**
     * Initialize all projections, then start them. Every projection is attempted; failures are reported together.
     */
    public void startAll() {
        List<Projection> all = snapshot();
        forEach(all, "initialize", Projection::initialize);
        forEach(all, "start", Projection::start);
        logger.info("Started {} projections", all.size());
    }

    public void stopAll() {
        List<Projection> all = snapshot();
        forEach(all, "stop", Projection::stop);
        logger.info("Stopped {} projections", all.size());
    }

    public void start(String name) {
        get(name).start();
    }

    public void stop(String name) {
        get(name).stop();
    }

    public void reset(String name) {
        get(name).reset();
    }

    public void rebuild(String name) {
        get(name).rebuild();
    }

    public List<ProjectionStats> getStats() {
        return snapshot().stream().map(Projection::getStats).collect(Collectors.toList());
    }

    /**
     * Names of projections whose error rate or lag is over the limit.
     */
    public List<String> getUnhealthyProjections() {
        return snapshot().stream()
                .filter(p -> !p.isHealthy())
                .map(Projection::getName)
                .collect(Collectors.toList());
    }

    public Collection<String> getProjectionNames() {
        synchronized (projections) {
            return new ArrayList<>(projections.keySet());
        }
    }

    private Projection get(String name) {
        Projection projection = projections.get(name);
        if (projection == null) {
            throw ProjectionException.notFound(name);
        }
        return projection;
    }

    private List<Projection> snapshot() {
        synchronized (projections) {
            return new ArrayList<>(projections.values());
        }
    }

    private void forEach(List<Projection> all, String action, Consumer<Projection> operation) {
        ProjectionException failure = null;
        for (Projection projection : all) {
            try {
                operation.accept(projection);
            } catch (RuntimeException e) {
                logger.error("Failed to {} projection {}", action, projection.getName(), e);
                if (failure == null) {
                    failure = ProjectionException.lifecycleFailed(projection.getName(), action, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
