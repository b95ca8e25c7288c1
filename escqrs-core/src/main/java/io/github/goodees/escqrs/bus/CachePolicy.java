package io.github.goodees.escqrs.bus;

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

/**
 * Opt-in caching of query results.
 */
public final class CachePolicy {
    private final long ttl;

    public CachePolicy(long ttl) {
        this.ttl = ttl;
    }

    public static CachePolicy ttl(long millis) {
        return new CachePolicy(millis);
    }

    /**
     * Time to live of cached result.
     * @return ttl in milliseconds, zero or less disables caching
     */
    public long getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return "CachePolicy{ttl=" + ttl + '}';
    }
}
