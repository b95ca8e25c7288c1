package io.github.goodees.escqrs.saga;

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

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

public class InMemorySagaRepository implements SagaRepository {
    private final ConcurrentMap<String, SagaInstance> sagas = new ConcurrentHashMap<>();

    @Override
    public void save(SagaInstance saga) {
        sagas.put(saga.getId(), saga.copy());
    }

    @Override
    public Optional<SagaInstance> findById(String sagaId) {
        return Optional.ofNullable(sagas.get(sagaId)).map(SagaInstance::copy);
    }

    @Override
    public List<SagaInstance> findByCorrelationId(String correlationId) {
        return sagas.values().stream()
                .filter(s -> s.getCorrelationId().equals(correlationId))
                .map(SagaInstance::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<SagaInstance> findByStatus(Collection<SagaStatus> statuses) {
        return sagas.values().stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .map(SagaInstance::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String sagaId) {
        sagas.remove(sagaId);
    }

    public int size() {
        return sagas.size();
    }
}
