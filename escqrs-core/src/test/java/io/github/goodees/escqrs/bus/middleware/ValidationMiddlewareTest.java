package io.github.goodees.escqrs.bus.middleware;

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

import io.github.goodees.escqrs.bus.Command;
import io.github.goodees.escqrs.bus.CommandBus;
import io.github.goodees.escqrs.bus.InvalidCommandException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.escqrs.bus.Outcome.failure;
import static io.github.goodees.escqrs.bus.Outcome.result;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;

public class ValidationMiddlewareTest {
    private ScheduledExecutorService scheduler;
    private CommandBus bus;
    private final AtomicInteger calls = new AtomicInteger();

    @Before
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        bus = new CommandBus(scheduler, Clock.systemUTC());
        bus.use(new ValidationMiddleware());
        bus.register("Deposit", command -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    public void command_without_source_rejected() throws Exception {
        Throwable error = failure(bus.send(Command.builder("Deposit", "acc-1").source(" ").build()));
        assertThat(error, instanceOf(InvalidCommandException.class));
        assertThat(error.getMessage(), containsString("Source is required in metadata"));
        assertEquals(0, calls.get());
    }

    @Test
    public void complete_command_passes() throws Exception {
        result(bus.send(Command.builder("Deposit", "acc-1").build()));
        assertEquals(1, calls.get());
    }
}
