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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Groups changes of several aggregates, so that they are saved together. Saving is not atomic across aggregates:
 * commit saves aggregates in order of registration and stops at first failure, leaving the failed aggregate and
 * the ones after it registered.
 */
public class UnitOfWork {
    private final List<Entry<?>> entries = new ArrayList<>();

    public <A extends AggregateRoot> void register(A aggregate, AggregateRepository<A> repository) {
        for (Entry<?> e : entries) {
            if (e.aggregate == aggregate) {
                return;
            }
        }
        entries.add(new Entry<>(aggregate, repository));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Save all registered aggregates that have uncommitted events.
     * @throws EventStoreException first failure; aggregates saved before it stay saved
     */
    public void commit() throws EventStoreException {
        Iterator<Entry<?>> it = entries.iterator();
        while (it.hasNext()) {
            Entry<?> entry = it.next();
            entry.save();
            it.remove();
        }
    }

    /**
     * Discard uncommitted events of all registered aggregates. The aggregates have already applied them, so they
     * need to be reloaded before further use.
     */
    public void rollback() {
        for (Entry<?> entry : entries) {
            entry.aggregate.discardUncommittedEvents();
        }
        entries.clear();
    }

    private static class Entry<A extends AggregateRoot> {
        private final A aggregate;
        private final AggregateRepository<A> repository;

        Entry(A aggregate, AggregateRepository<A> repository) {
            this.aggregate = aggregate;
            this.repository = repository;
        }

        void save() throws EventStoreException {
            if (aggregate.hasUncommittedEvents()) {
                repository.save(aggregate);
            }
        }
    }
}
