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

import java.time.Instant;

/**
 * Position up to which a projection has processed the event log.
 */
@Value.Immutable
@ImmutablesSupport
public interface Checkpoint {
    String getProjectionName();

    long getPosition();

    Instant getTimestamp();

    static Checkpoint of(String projectionName, long position, Instant timestamp) {
        return ImmutableCheckpoint.builder()
                .projectionName(projectionName)
                .position(position)
                .timestamp(timestamp)
                .build();
    }
}
