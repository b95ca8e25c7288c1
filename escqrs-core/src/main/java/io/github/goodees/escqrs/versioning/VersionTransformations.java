package io.github.goodees.escqrs.versioning;

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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Common payload transformations for use in {@link VersionRule}s. All of them return a new event, the input is left
 * untouched.
 */
public final class VersionTransformations {

    private VersionTransformations() {
    }

    public static UnaryOperator<DomainEvent> addField(String field, Object defaultValue) {
        return event -> {
            if (event.getEventData().containsKey(field)) {
                return event;
            }
            Map<String, Object> data = copy(event);
            data.put(field, defaultValue);
            return event.withEventData(data);
        };
    }

    public static UnaryOperator<DomainEvent> removeField(String field) {
        return event -> {
            Map<String, Object> data = copy(event);
            data.remove(field);
            return event.withEventData(data);
        };
    }

    public static UnaryOperator<DomainEvent> renameField(String from, String to) {
        return event -> {
            if (!event.getEventData().containsKey(from)) {
                return event;
            }
            Map<String, Object> data = copy(event);
            data.put(to, data.remove(from));
            return event.withEventData(data);
        };
    }

    public static UnaryOperator<DomainEvent> transformField(String field, Function<Object, Object> function) {
        return event -> {
            if (!event.getEventData().containsKey(field)) {
                return event;
            }
            Map<String, Object> data = copy(event);
            data.put(field, function.apply(data.get(field)));
            return event.withEventData(data);
        };
    }

    /**
     * Split one field into several. The splitter returns values for each of the target fields, fields it omits are
     * not set. The source field is removed.
     * @param field source field
     * @param splitter produces the new fields from the value of source field
     * @return the transformation
     */
    public static UnaryOperator<DomainEvent> splitField(String field,
            Function<Object, Map<String, Object>> splitter) {
        return event -> {
            if (!event.getEventData().containsKey(field)) {
                return event;
            }
            Map<String, Object> data = copy(event);
            Object value = data.remove(field);
            data.putAll(splitter.apply(value));
            return event.withEventData(data);
        };
    }

    /**
     * Combine several fields into one. Combined fields are removed.
     * @param target name of resulting field
     * @param combiner function receiving values of the source fields, in order of {@code fields}
     * @param fields source fields
     * @return the transformation
     */
    public static UnaryOperator<DomainEvent> combineFields(String target, Function<List<Object>, Object> combiner,
            String... fields) {
        return event -> {
            Map<String, Object> data = copy(event);
            List<Object> values = Arrays.asList(new Object[fields.length]);
            for (int i = 0; i < fields.length; i++) {
                values.set(i, data.remove(fields[i]));
            }
            data.put(target, combiner.apply(values));
            return event.withEventData(data);
        };
    }

    private static Map<String, Object> copy(DomainEvent event) {
        return new LinkedHashMap<>(event.getEventData());
    }
}
