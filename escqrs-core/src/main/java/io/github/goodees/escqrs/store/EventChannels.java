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

import java.util.Arrays;
import java.util.List;

/**
 * Names under which every committed event is published. Each event goes to {@link #ALL}, to the channel of its
 * event type and to the channel of its aggregate type.
 */
public final class EventChannels {
    public static final String ALL = "event";

    private EventChannels() {
    }

    public static String eventType(String eventType) {
        return "event-" + eventType;
    }

    public static String aggregateType(String aggregateType) {
        return "aggregate-" + aggregateType;
    }

    static List<String> of(DomainEvent event) {
        return Arrays.asList(ALL, eventType(event.getEventType()), aggregateType(event.getAggregateType()));
    }
}
