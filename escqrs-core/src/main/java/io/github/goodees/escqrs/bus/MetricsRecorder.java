package io.github.goodees.escqrs.bus;

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

import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable counterpart of {@link BusMetrics}.
 */
class MetricsRecorder {
    private long processed;
    private long failed;
    private double averageProcessingTime;
    private final Map<String, Long> countsByType = new TreeMap<>();
    private long cacheHits;
    private long cacheMisses;

    synchronized void record(String messageType, long durationMillis, boolean success) {
        processed++;
        if (!success) {
            failed++;
        }
        averageProcessingTime += (durationMillis - averageProcessingTime) / processed;
        countsByType.merge(messageType, 1L, Long::sum);
    }

    synchronized void cacheHit() {
        cacheHits++;
    }

    synchronized void cacheMiss() {
        cacheMisses++;
    }

    synchronized BusMetrics snapshot() {
        return ImmutableBusMetrics.builder()
                .processed(processed)
                .failed(failed)
                .averageProcessingTime(averageProcessingTime)
                .putAllCountsByType(countsByType)
                .cacheHits(cacheHits)
                .cacheMisses(cacheMisses)
                .build();
    }

    synchronized void reset() {
        processed = 0;
        failed = 0;
        averageProcessingTime = 0;
        countsByType.clear();
        cacheHits = 0;
        cacheMisses = 0;
    }
}
