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

/**
 * Projection failed, or does not exist.
 */
public class ProjectionException extends RuntimeException {
    private final String projectionName;

    public ProjectionException(String projectionName, String message, Throwable cause) {
        super(message, cause);
        this.projectionName = projectionName;
    }

    public ProjectionException(String projectionName, String message) {
        this(projectionName, message, null);
    }

    public String getProjectionName() {
        return projectionName;
    }

    public static ProjectionException notFound(String projectionName) {
        return new ProjectionException(projectionName, "Projection not found: " + projectionName);
    }

    public static ProjectionException stopped(String projectionName, long position, int errorCount,
            Throwable cause) {
        return new ProjectionException(projectionName, "Projection " + projectionName + " stopped after "
                + errorCount + " errors at position " + position, cause);
    }

    public static ProjectionException lifecycleFailed(String projectionName, String action, Throwable cause) {
        return new ProjectionException(projectionName, "Failed to " + action + " projection " + projectionName,
                cause);
    }

    public static ProjectionException checkpointFailed(String projectionName, Throwable cause) {
        return new ProjectionException(projectionName, "Checkpoint of " + projectionName + " failed", cause);
    }
}
