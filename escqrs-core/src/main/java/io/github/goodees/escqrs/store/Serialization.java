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

import io.github.goodees.escqrs.event.DomainEvent;

import java.util.Map;

/**
 * Conversion of events and aggregate state into their stored textual form.
 */
public interface Serialization {

    StoredEvent serialize(DomainEvent event) throws EventStoreException;

    DomainEvent deserialize(StoredEvent stored) throws EventStoreException;

    /**
     * Serialize state of a snapshot or any other structured data. Same input always yields same output, so that
     * the result is usable for checksums and cache keys.
     * @param state the state
     * @return canonical textual form
     * @throws EventStoreException when state contains values that cannot be serialized
     */
    String serializeState(Map<String, Object> state) throws EventStoreException;

    Map<String, Object> deserializeState(String serialized) throws EventStoreException;

    /**
     * Tag of format recorded in event and snapshot metadata.
     * @return format name
     */
    String format();
}
