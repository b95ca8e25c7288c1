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

import io.github.goodees.escqrs.bus.middleware.AuthorizationMiddleware;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.escqrs.bus.Outcome.failure;
import static io.github.goodees.escqrs.bus.Outcome.result;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;

public class QueryBusTest {
    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private QueryBus bus;
    private final AtomicInteger calls = new AtomicInteger();

    @Before
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new MutableClock(Instant.parse("2017-06-01T10:00:00Z"));
        bus = new QueryBus(scheduler, clock);
        bus.register("GetBalance", query -> {
            calls.incrementAndGet();
            if ("closed".equals(query.getParameters().get("accountId"))) {
                throw new IllegalStateException("Account closed");
            }
            return CompletableFuture.completedFuture(Collections.singletonMap("balance", calls.get() * 100));
        });
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    private static Query balance(String accountId, long ttl) {
        Query.Builder builder = Query.builder("GetBalance").parameter("accountId", accountId);
        if (ttl > 0) {
            builder.cachePolicy(CachePolicy.ttl(ttl));
        }
        return builder.build();
    }

    @Test
    public void cached_result_served_until_ttl_expires() throws Exception {
        Object first = result(bus.execute(balance("acc-1", 1000)));
        clock.advance(999);
        assertEquals(first, result(bus.execute(balance("acc-1", 1000))));
        assertEquals(1, calls.get());

        clock.advance(1);
        result(bus.execute(balance("acc-1", 1000)));
        assertEquals(2, calls.get());

        BusMetrics metrics = bus.getMetrics();
        assertEquals(1, metrics.getCacheHits());
        assertEquals(2, metrics.getCacheMisses());
        assertEquals(2, metrics.getProcessed());
    }

    @Test
    public void cache_key_ignores_parameter_order() throws Exception {
        Query first = Query.builder("GetBalance").parameter("accountId", "acc-1").parameter("currency", "EUR")
                .cachePolicy(CachePolicy.ttl(1000)).build();
        Query second = Query.builder("GetBalance").parameter("currency", "EUR").parameter("accountId", "acc-1")
                .cachePolicy(CachePolicy.ttl(1000)).build();
        result(bus.execute(first));
        result(bus.execute(second));
        assertEquals(1, calls.get());
    }

    @Test
    public void queries_without_cache_policy_always_run() throws Exception {
        result(bus.execute(balance("acc-1", 0)));
        result(bus.execute(balance("acc-1", 0)));
        assertEquals(2, calls.get());
    }

    @Test
    public void failed_results_are_not_cached() throws Exception {
        failure(bus.execute(balance("closed", 1000)));
        failure(bus.execute(balance("closed", 1000)));
        assertEquals(2, calls.get());
        assertEquals(2, bus.getMetrics().getFailed());
    }

    @Test
    public void invalidated_type_runs_again() throws Exception {
        result(bus.execute(balance("acc-1", 1000)));
        result(bus.execute(balance("acc-2", 1000)));
        assertEquals(2, bus.invalidateCache("GetBalance"));
        result(bus.execute(balance("acc-1", 1000)));
        assertEquals(3, calls.get());
    }

    @Test
    public void invalid_query_rejected_before_cache() throws Exception {
        Query query = Query.builder("GetBalance").correlationId("").cachePolicy(CachePolicy.ttl(1000)).build();
        assertThat(failure(bus.execute(query)), instanceOf(InvalidQueryException.class));
        assertEquals(0, bus.getMetrics().getCacheMisses());
        assertEquals(0, calls.get());
    }

    @Test
    public void missing_handler_reported() throws Exception {
        assertThat(failure(bus.execute(Query.builder("GetHistory").build())),
                instanceOf(QueryHandlerNotFoundException.class));
    }

    @Test
    public void unauthorized_query_never_reaches_handler() throws Exception {
        bus.use(AuthorizationMiddleware.allowing(q -> "teller".equals(q.getUserId())));
        Query anonymous = Query.builder("GetBalance").parameter("accountId", "acc-1").build();
        Throwable error = failure(bus.execute(anonymous));
        assertThat(error, instanceOf(UnauthorizedQueryException.class));
        assertEquals(0, calls.get());

        result(bus.execute(anonymous.toBuilder().userId("teller").build()));
        assertEquals(1, calls.get());
    }
}
