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

/**
 * Persistence of saga instances. Implementations store and return copies.
 */
public interface SagaRepository {
    void save(SagaInstance saga);

    Optional<SagaInstance> findById(String sagaId);

    List<SagaInstance> findByCorrelationId(String correlationId);

    List<SagaInstance> findByStatus(Collection<SagaStatus> statuses);

    void delete(String sagaId);
}
