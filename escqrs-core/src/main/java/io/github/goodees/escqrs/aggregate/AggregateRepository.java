package io.github.goodees.escqrs.aggregate;

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

import io.github.goodees.escqrs.store.EventStoreException;

import java.util.Optional;

/**
 * Loads and saves aggregates of one type.
 * @param <A> type of aggregate
 */
public interface AggregateRepository<A extends AggregateRoot> {

    /**
     * Recover aggregate.
     * @param id identity of aggregate
     * @return recovered aggregate
     * @throws AggregateNotFoundException when the aggregate has no history
     * @throws EventStoreException when reading fails
     */
    A getById(String id) throws EventStoreException;

    Optional<A> findById(String id) throws EventStoreException;

    /**
     * Persist uncommitted events of the aggregate.
     * @param aggregate the aggregate
     * @throws io.github.goodees.escqrs.store.ConcurrencyException when the aggregate was changed concurrently
     * @throws EventStoreException when storing fails
     */
    void save(A aggregate) throws EventStoreException;

    boolean exists(String id) throws EventStoreException;

    boolean delete(String id) throws EventStoreException;
}
