package io.github.goodees.escqrs.replay;

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
import java.util.List;
import java.util.Optional;

@Value.Immutable
@ImmutablesSupport
public interface ReplayProgress {
    String getReplayId();

    /**
     * Number of matching events found when the replay started, counted up to
     * {@link EventReplay#ESTIMATE_LIMIT}.
     */
    long getEstimatedTotal();

    long getProcessedEvents();

    long getFailedEvents();

    long getSkippedEvents();

    /**
     * Position of the last event the replay went through, 0 before the first one.
     */
    long getCurrentPosition();

    ReplayStatus getStatus();

    Instant getStartTime();

    Optional<Instant> getEndTime();

    Optional<Instant> getEstimatedCompletionTime();

    Optional<String> getFailureReason();

    List<ReplayError> getErrors();
}
