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
import io.github.goodees.escqrs.event.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live subscriptions of an event store. Listener failures are logged and isolated from other listeners and from
 * the writer.
 */
class EventSubscriptions {
    private static final Logger logger = LoggerFactory.getLogger(EventSubscriptions.class);

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    String subscribe(EventFilter filter, EventListener listener) {
        String id = UUID.randomUUID().toString();
        subscriptions.put(id, new Subscription(id, null, filter, listener));
        return id;
    }

    String subscribe(String channel, EventListener listener) {
        String id = UUID.randomUUID().toString();
        subscriptions.put(id, new Subscription(id, channel, EventFilter.all(), listener));
        return id;
    }

    boolean unsubscribe(String id) {
        return subscriptions.remove(id) != null;
    }

    int size() {
        return subscriptions.size();
    }

    void publish(RecordedEvent event) {
        for (String channel : EventChannels.of(event.getEvent())) {
            for (Subscription s : subscriptions.values()) {
                if (channel.equals(s.channel)) {
                    deliver(s, event);
                }
            }
        }
        for (Subscription s : subscriptions.values()) {
            if (s.channel == null && s.filter.matches(event.getEvent())) {
                deliver(s, event);
            }
        }
    }

    private void deliver(Subscription s, RecordedEvent event) {
        try {
            s.listener.onEvent(event);
        } catch (Exception e) {
            logger.error("Subscription {} failed to process {}", s.id, event, e);
        }
    }

    private static class Subscription {
        private final String id;
        private final String channel;
        private final EventFilter filter;
        private final EventListener listener;

        Subscription(String id, String channel, EventFilter filter, EventListener listener) {
            this.id = id;
            this.channel = channel;
            this.filter = filter;
            this.listener = listener;
        }
    }
}
