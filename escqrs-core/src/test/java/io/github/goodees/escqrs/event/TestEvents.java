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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Factory of events for tests.
 */
public final class TestEvents {
    public static final String ACCOUNT = "Account";

    private TestEvents() {
    }

    public static DomainEvent.Builder event(String aggregateId, long version, String eventType) {
        return DomainEvent.builder().id(UUID.randomUUID().toString()).aggregateId(aggregateId)
                .aggregateType(ACCOUNT).version(version).eventType(eventType)
                .metadata(EventMetadata.builder().correlationId("corr-" + aggregateId).source("test").build())
                .timestamp(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    public static DomainEvent deposited(String aggregateId, long version, int amount) {
        return event(aggregateId, version, "Deposited").put("amount", amount).build();
    }
}
