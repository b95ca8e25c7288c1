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

import io.github.goodees.escqrs.event.DomainEvent;
import io.github.goodees.escqrs.event.RecordedEvent;
import io.github.goodees.escqrs.matching.EventHandlers;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Receiver of replayed events.
 */
public interface ReplayHandler {
    String getName();

    boolean canHandle(DomainEvent event);

    /**
     * Apply replayed event.
     * @param event event with its position in the log
     * @throws Exception when the event could not be applied; the failure is recorded in the replay progress
     */
    void handle(RecordedEvent event) throws Exception;

    /**
     * Handler applying the event types known to a dispatch table. Other events are not offered to it.
     */
    static ReplayHandler of(String name, EventHandlers handlers) {
        Objects.requireNonNull(handlers);
        return new ReplayHandler() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean canHandle(DomainEvent event) {
                return handlers.handles(event.getEventType());
            }

            @Override
            public void handle(RecordedEvent event) {
                handlers.apply(event.getEvent());
            }
        };
    }

    /**
     * Handler receiving every event of an aggregate type.
     */
    static ReplayHandler forAggregateType(String aggregateType, Consumer<DomainEvent> callback) {
        Objects.requireNonNull(callback);
        return new ReplayHandler() {
            @Override
            public String getName() {
                return aggregateType + "-replay";
            }

            @Override
            public boolean canHandle(DomainEvent event) {
                return aggregateType.equals(event.getAggregateType());
            }

            @Override
            public void handle(RecordedEvent event) {
                callback.accept(event.getEvent());
            }
        };
    }
}
