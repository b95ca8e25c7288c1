package io.github.goodees.escqrs.event;

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

import java.util.Objects;

/**
 * An event as it was recorded in the log, together with its global position. Positions are assigned by the storage
 * and increase across all streams, so they serve as checkpoints for consumers reading the whole log.
 */
public final class RecordedEvent {
    private final long position;
    private final DomainEvent event;

    public RecordedEvent(long position, DomainEvent event) {
        this.position = position;
        this.event = Objects.requireNonNull(event);
    }

    public long getPosition() {
        return position;
    }

    public DomainEvent getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordedEvent)) {
            return false;
        }
        RecordedEvent that = (RecordedEvent) o;
        return position == that.position && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, event);
    }

    @Override
    public String toString() {
        return "#" + position + " " + event;
    }
}
