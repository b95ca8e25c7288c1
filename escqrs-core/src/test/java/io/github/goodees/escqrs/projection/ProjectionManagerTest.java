package io.github.goodees.escqrs.projection;

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

import io.github.goodees.escqrs.projection.inmemory.InMemoryCheckpointStore;
import io.github.goodees.escqrs.store.EventStore;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.JacksonSerialization;
import io.github.goodees.escqrs.store.inmemory.InMemorySnapshotStore;
import io.github.goodees.escqrs.store.inmemory.InMemoryStorageRepository;
import io.github.goodees.escqrs.versioning.EventVersionManager;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static io.github.goodees.escqrs.event.TestEvents.deposited;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ProjectionManagerTest {
    private EventStore eventStore;
    private InMemoryCheckpointStore checkpointStore;
    private ProjectionManager manager;
    private BalanceProjection balances;
    private BalanceProjection audit;

    @Before
    public void setUp() throws EventStoreException {
        eventStore = new EventStore(new InMemoryStorageRepository(), new InMemorySnapshotStore(),
                new EventVersionManager(), new JacksonSerialization());
        checkpointStore = new InMemoryCheckpointStore();
        ProjectionOptions options = ProjectionOptions.builder().retryAttempts(1).retryDelay(1).build();
        balances = new BalanceProjection("balances", eventStore, checkpointStore, options);
        audit = new BalanceProjection("audit", eventStore, checkpointStore, options);
        manager = new ProjectionManager();
        manager.register(balances);
        manager.register(audit);
        eventStore.saveEvents("a", Collections.singletonList(deposited("a", 1, 10)), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void name_registered_once() {
        manager.register(new BalanceProjection("balances", eventStore, checkpointStore,
                ProjectionOptions.defaults()));
    }

    @Test
    public void all_projections_started_and_stopped() {
        manager.startAll();
        assertTrue(balances.isRunning());
        assertTrue(audit.isRunning());
        assertEquals(10, audit.balance("a"));
        assertThat(manager.getStats().stream().map(ProjectionStats::getName).collect(toList()),
                contains("balances", "audit"));

        manager.stopAll();
        assertFalse(balances.isRunning());
        assertFalse(audit.isRunning());
    }

    @Test
    public void failing_projection_does_not_prevent_others_from_starting() {
        balances.failuresLeft = Integer.MAX_VALUE;
        try {
            manager.startAll();
            fail("should have failed");
        } catch (ProjectionException e) {
            assertEquals("balances", e.getProjectionName());
        }
        assertTrue(audit.isRunning());
        assertFalse(balances.isRunning());
        assertThat(manager.getUnhealthyProjections(), contains("balances"));
    }

    @Test
    public void running_projection_cannot_be_unregistered() {
        manager.start("audit");
        try {
            manager.unregister("audit");
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertTrue(manager.getProjection("audit").isPresent());
        }
        manager.stop("audit");
        assertTrue(manager.unregister("audit"));
        assertFalse(manager.unregister("audit"));
        assertThat(manager.getProjectionNames(), contains("balances"));
    }

    @Test
    public void rebuild_by_name() {
        manager.start("audit");
        manager.rebuild("audit");
        assertEquals(10, audit.balance("a"));
        assertEquals(1, audit.resets);
        assertThat(manager.getUnhealthyProjections(), empty());
    }

    @Test(expected = ProjectionException.class)
    public void unknown_projection_is_reported() {
        manager.reset("missing");
    }
}
