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

import io.github.goodees.escqrs.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.util.Optional;

@Value.Immutable
@ImmutablesSupport
public interface ProjectionStats {
    String getName();

    long getLastPosition();

    long getEventsProcessed();

    int getErrorCount();

    Optional<String> getLastError();

    /**
     * Events processed per second since start.
     */
    double getProcessingRate();

    /**
     * Milliseconds since the timestamp of last processed event.
     */
    long getLag();

    boolean isHealthy();

    boolean isRunning();
}
