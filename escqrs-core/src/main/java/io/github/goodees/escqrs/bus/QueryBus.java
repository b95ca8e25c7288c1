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

import io.github.goodees.escqrs.store.JacksonSerialization;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Routes every query to the single handler registered for its type, serving cached results where the query's
 * cache policy allows.
 */
public class QueryBus extends AbstractBus<Query, QueryHandler> {
    private final QueryCache cache;

    /**
     * Bus with its own timeout scheduler, stopped by {@link #shutdown()}.
     */
    public QueryBus() {
        super(defaultScheduler("query-bus-timer"), Clock.systemUTC(), true);
        this.cache = new QueryCache(JacksonSerialization.defaultMapper(), clock);
    }

    public QueryBus(ScheduledExecutorService scheduler, Clock clock) {
        this(scheduler, clock, new QueryCache(JacksonSerialization.defaultMapper(), clock));
    }

    public QueryBus(ScheduledExecutorService scheduler, Clock clock, QueryCache cache) {
        super(scheduler, clock);
        this.cache = cache;
    }

    /**
     * Execute query. Cache is consulted after validation and before handler lookup.
     * @param query the query
     * @param <R> result type of the handler
     * @return handler's or cached result
     */
    public <R> CompletableFuture<R> execute(Query query) {
        try {
            validate(query);
        } catch (InvalidQueryException e) {
            metrics.record(query == null || query.getQueryType() == null ? "unknown" : query.getQueryType(), 0,
                    false);
            return Futures.failed(e);
        }
        Optional<Object> cached = cache.get(query);
        if (cached.isPresent()) {
            metrics.cacheHit();
            logger.debug("Cache hit for {}", query);
            return typed(CompletableFuture.completedFuture(cached.get()));
        }
        metrics.cacheMiss();
        return typed(process(query));
    }

    @Override
    protected void onSuccess(Query query, Object result) {
        CachePolicy policy = query.getMetadata().getCachePolicy();
        if (policy != null && policy.getTtl() > 0) {
            cache.put(query, result, policy.getTtl());
        }
    }

    public int invalidateCache(String queryType) {
        return cache.invalidate(queryType);
    }

    public void clearCache() {
        cache.clear();
    }

    static void validate(Query query) {
        if (query == null) {
            throw new InvalidQueryException("Query is missing");
        }
        if (isBlank(query.getId())) {
            throw new InvalidQueryException("Query id is required");
        }
        if (isBlank(query.getQueryType())) {
            throw new InvalidQueryException("Query type is required");
        }
        if (isBlank(query.getCorrelationId())) {
            throw new InvalidQueryException("Correlation id is required for " + query.getQueryType());
        }
        if (query.getTimestamp() == null) {
            throw new InvalidQueryException("Query timestamp is required");
        }
    }

    @Override
    protected RuntimeException handlerNotFound(String messageType) {
        return new QueryHandlerNotFoundException(messageType);
    }

    @Override
    protected CompletionStage<?> invokeHandler(QueryHandler handler, Query message) throws Exception {
        return handler.handle(message);
    }
}
