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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.escqrs.event.DomainEvent;
import io.github.goodees.escqrs.event.EventMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON serialization of events backed by Jackson. Payload and metadata are stored as separate JSON objects, the
 * envelope fields (ids, version, type, timestamp) are kept in {@link StoredEvent} as they are.
 */
public class JacksonSerialization implements Serialization {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    private final ObjectMapper mapper;

    public JacksonSerialization() {
        this(defaultMapper());
    }

    public JacksonSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Mapper producing canonical output, with map entries ordered by keys and java.time values written as ISO
     * strings.
     * @return new object mapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper().registerModules(new Jdk8Module(), new JavaTimeModule())
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public StoredEvent serialize(DomainEvent event) throws EventStoreException {
        try {
            String payload = mapper.writeValueAsString(event.getEventData());
            String metadata = mapper.writeValueAsString(event.getMetadata().toMap());
            return new StoredEvent(event.getId(), event.getStreamKey(), event.getAggregateId(),
                    event.getAggregateType(), event.getVersion(), event.getEventType(), payload, metadata,
                    event.getTimestamp(), 0);
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed("event " + event, e);
        }
    }

    @Override
    public DomainEvent deserialize(StoredEvent stored) throws EventStoreException {
        try {
            Map<String, Object> payload = stored.getPayload() == null ? new LinkedHashMap<>()
                    : mapper.readValue(stored.getPayload(), MAP_TYPE);
            Map<String, Object> metadata = stored.getMetadata() == null ? new LinkedHashMap<>()
                    : mapper.readValue(stored.getMetadata(), MAP_TYPE);
            return DomainEvent.builder().id(stored.getEventId()).aggregateId(stored.getAggregateId())
                    .aggregateType(stored.getAggregateType()).version(stored.getVersion())
                    .eventType(stored.getEventType()).eventData(payload).metadata(EventMetadata.fromMap(metadata))
                    .timestamp(stored.getTimestamp()).build();
        } catch (JsonProcessingException e) {
            throw EventStoreException.deserializationFailed("event " + stored, e);
        }
    }

    @Override
    public String serializeState(Map<String, Object> state) throws EventStoreException {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw EventStoreException.serializationFailed("state", e);
        }
    }

    @Override
    public Map<String, Object> deserializeState(String serialized) throws EventStoreException {
        try {
            return mapper.readValue(serialized, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw EventStoreException.deserializationFailed("state", e);
        }
    }

    @Override
    public String format() {
        return EventMetadata.DEFAULT_SERIALIZATION;
    }
}
