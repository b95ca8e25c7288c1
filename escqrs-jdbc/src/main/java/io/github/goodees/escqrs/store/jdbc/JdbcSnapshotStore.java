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

import io.github.goodees.escqrs.event.DomainEvent;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.Serialization;
import io.github.goodees.escqrs.store.SnapshotStoreWithSerialization;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot store keeping multiple snapshots per aggregate, one row per snapshot version. Storing a snapshot for an
 * already snapshotted version replaces it.
 */
public class JdbcSnapshotStore extends SnapshotStoreWithSerialization {
    private final DataSource ds;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization serialization) {
        this(ds, schema, serialization, TxHandler.LOCAL);
    }

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization serialization, TxHandler txHandler) {
        super(Objects.requireNonNull(serialization));
        this.ds = ds;
        this.schema = schema;
        this.txHandler = txHandler;
    }

    @Override
    protected SnapshotRecord retrieveLatestSnapshotRecord(String aggregateId, String aggregateType)
            throws EventStoreException {
        List<SnapshotRecord> records = retrieve(aggregateId, aggregateType, 1);
        return records.isEmpty() ? null : records.get(0);
    }

    @Override
    protected List<SnapshotRecord> retrieveSnapshotRecords(String aggregateId, String aggregateType)
            throws EventStoreException {
        return retrieve(aggregateId, aggregateType, Integer.MAX_VALUE);
    }

    private List<SnapshotRecord> retrieve(String aggregateId, String aggregateType, int limit)
            throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshots(connection, aggregateId, aggregateType, limit);
                ResultSet rs = st.executeQuery()) {
            List<SnapshotRecord> result = new ArrayList<>();
            while (rs.next()) {
                result.add(new SnapshotRecord(aggregateId, aggregateType, schema.readSnapshotVersion(rs),
                        schema.readSnapshotTimestamp(rs), schema.readSnapshotMetadata(rs),
                        schema.readSnapshotPayload(rs)));
            }
            return result;
        } catch (SQLException se) {
            throw EventStoreException.readFailed("snapshots of " + DomainEvent.streamKey(aggregateType, aggregateId),
                    se);
        }
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord record) throws EventStoreException {
        String streamKey = DomainEvent.streamKey(record.getAggregateType(), record.getAggregateId());
        try (Connection connection = txHandler.enroll(ds.getConnection())) {
            try (PreparedStatement delete = schema.deleteSnapshot(connection, record.getAggregateId(),
                    record.getAggregateType(), record.getVersion());
                    PreparedStatement insert = schema.insertSnapshot(connection, record.getAggregateId(),
                            record.getAggregateType(), record.getVersion(), record.getTimestamp(),
                            record.getMetadata(), record.getPayload())) {
                delete.executeUpdate();
                if (insert.executeUpdate() != 1) {
                    logger.error("Snapshot insert did not create a row for {}", streamKey);
                }
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException se) {
            throw EventStoreException.storeFailed("snapshot of " + streamKey, se);
        }
        logger.debug("Stored snapshot of {} at version {}", streamKey, record.getVersion());
    }

    @Override
    public int deleteOldSnapshots(String aggregateId, String aggregateType, int keepCount)
            throws EventStoreException {
        List<SnapshotRecord> records = retrieve(aggregateId, aggregateType, Integer.MAX_VALUE);
        if (records.size() <= keepCount) {
            return 0;
        }
        long newestToDelete = records.get(Math.max(keepCount, 0)).getVersion();
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.deleteSnapshotsUpTo(connection, aggregateId, aggregateType,
                        newestToDelete)) {
            return st.executeUpdate();
        } catch (SQLException se) {
            throw EventStoreException.storeFailed("snapshots of " + DomainEvent.streamKey(aggregateType, aggregateId),
                    se);
        }
    }

    @Override
    public void deleteSnapshots(String aggregateId, String aggregateType) throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.deleteSnapshotsUpTo(connection, aggregateId, aggregateType,
                        Long.MAX_VALUE)) {
            st.executeUpdate();
        } catch (SQLException se) {
            throw EventStoreException.storeFailed("snapshots of " + DomainEvent.streamKey(aggregateType, aggregateId),
                    se);
        }
    }
}
