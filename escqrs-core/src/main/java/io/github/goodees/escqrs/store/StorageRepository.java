package io.github.goodees.escqrs.store;

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

import io.github.goodees.escqrs.event.EventFilter;

import java.util.List;

/**
 * Durable append-only storage of serialized events, organized in streams. Every operation is atomic.
 * <p>Implementations must refuse a batch whose first version does not directly follow the current version of the
 * stream with {@link ConcurrencyException}. This is the final line of optimistic concurrency control, in case two
 * writers passed the version check of {@link EventStore} at the same time.
 */
public interface StorageRepository {

    /**
     * Append events to the stream.
     * @param streamKey the stream
     * @param events serialized events, contiguous versions following current version of the stream
     * @return the saved events with assigned global positions
     * @throws EventStoreException on concurrent modification or storage failure
     */
    List<StoredEvent> saveEvents(String streamKey, List<StoredEvent> events) throws EventStoreException;

    /**
     * Read events of a stream within version range, in version order.
     * @param streamKey the stream
     * @param fromVersion lowest version, inclusive
     * @param toVersion highest version, inclusive
     * @return events, empty list for unknown stream
     * @throws EventStoreException on storage failure
     */
    List<StoredEvent> getEvents(String streamKey, long fromVersion, long toVersion) throws EventStoreException;

    /**
     * Current (highest) version of the stream.
     * @param streamKey the stream
     * @return version, 0 for stream without events
     * @throws EventStoreException on storage failure
     */
    long getCurrentVersion(String streamKey) throws EventStoreException;

    /**
     * Read events across all streams in global order.
     * @param filter criteria events must match
     * @param fromPosition position to read after, exclusive
     * @param batchSize maximum number of events returned
     * @return matching events ordered by position
     * @throws EventStoreException on storage failure
     */
    List<StoredEvent> getAllEvents(EventFilter filter, long fromPosition, int batchSize) throws EventStoreException;

    /**
     * Remove events of the stream older than given version. The current version of stream stays unchanged.
     * @param streamKey the stream
     * @param beforeVersion events with lower version are removed
     * @return number of removed events
     * @throws EventStoreException on storage failure
     */
    int truncateStream(String streamKey, long beforeVersion) throws EventStoreException;

    /**
     * Remove the stream completely.
     * @param streamKey the stream
     * @return true if the stream existed
     * @throws EventStoreException on storage failure
     */
    boolean deleteStream(String streamKey) throws EventStoreException;

    /**
     * Number of streams having at least one event.
     * @return stream count
     * @throws EventStoreException on storage failure
     */
    long streamCount() throws EventStoreException;
}
