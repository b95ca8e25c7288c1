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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Results of queries keyed by query type and canonical JSON of its parameters. Entries expire lazily on read.
 */
public class QueryCache {
    private static final Logger logger = LoggerFactory.getLogger(QueryCache.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final Clock clock;

    public QueryCache(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Compute cache key of a query.
     * @param query the query
     * @return key, or empty if parameters cannot be rendered as JSON
     */
    public Optional<String> keyOf(Query query) {
        Map<String, Object> keyed = new LinkedHashMap<>();
        keyed.put("queryType", query.getQueryType());
        keyed.put("parameters", query.getParameters());
        try {
            return Optional.of(query.getQueryType() + ":" + mapper.writeValueAsString(keyed));
        } catch (JsonProcessingException e) {
            logger.warn("Cannot compute cache key of {}, result will not be cached", query, e);
            return Optional.empty();
        }
    }

    public Optional<Object> get(Query query) {
        return keyOf(query).flatMap(this::get);
    }

    Optional<Object> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt <= clock.millis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    /**
     * Store result of query. Null results and non-positive ttl are not cached.
     */
    public void put(Query query, Object result, long ttl) {
        if (result == null || ttl <= 0) {
            return;
        }
        keyOf(query).ifPresent(key -> entries.put(key, new Entry(result, clock.millis() + ttl)));
    }

    public int invalidate(String queryType) {
        String prefix = queryType + ":";
        int before = entries.size();
        entries.keySet().removeIf(k -> k.startsWith(prefix));
        return before - entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static class Entry {
        final Object value;
        final long expiresAt;

        Entry(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
