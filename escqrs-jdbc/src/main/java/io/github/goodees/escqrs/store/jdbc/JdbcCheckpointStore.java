package io.github.goodees.escqrs.store.jdbc;

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

import io.github.goodees.escqrs.projection.Checkpoint;
import io.github.goodees.escqrs.projection.CheckpointStore;
import io.github.goodees.escqrs.projection.ProjectionException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Projection checkpoints in a table, one row per projection.
 */
public class JdbcCheckpointStore implements CheckpointStore {
    private final DataSource ds;
    private final JdbcSchema schema;

    public JdbcCheckpointStore(DataSource ds, JdbcSchema schema) {
        this.ds = ds;
        this.schema = schema;
    }

    @Override
    public void save(Checkpoint checkpoint) {
        try (Connection connection = ds.getConnection();
                PreparedStatement update = schema.updateCheckpoint(connection, checkpoint)) {
            if (update.executeUpdate() == 0) {
                try (PreparedStatement insert = schema.insertCheckpoint(connection, checkpoint)) {
                    insert.executeUpdate();
                }
            }
        } catch (SQLException e) {
            throw ProjectionException.checkpointFailed(checkpoint.getProjectionName(), e);
        }
    }

    @Override
    public Optional<Checkpoint> load(String projectionName) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectCheckpoint(connection, projectionName);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? Optional.of(schema.readCheckpoint(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw ProjectionException.checkpointFailed(projectionName, e);
        }
    }

    @Override
    public boolean delete(String projectionName) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.deleteCheckpoint(connection, projectionName)) {
            return st.executeUpdate() > 0;
        } catch (SQLException e) {
            throw ProjectionException.checkpointFailed(projectionName, e);
        }
    }
}
