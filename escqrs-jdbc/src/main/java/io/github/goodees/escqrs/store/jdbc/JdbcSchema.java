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

import io.github.goodees.escqrs.event.EventFilter;
import io.github.goodees.escqrs.projection.Checkpoint;
import io.github.goodees.escqrs.store.SnapshotMetadata;
import io.github.goodees.escqrs.store.StoredEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Statements and result set mapping of the JDBC stores. Implementations decide table layout and SQL dialect; the
 * stores only drive transactions and the sequence of statements.
 *
 * <p>Statements returned by the {@code select*} methods have their parameters set and are ready to execute.
 * Statements returned by {@code insert*} methods are parametrized by matching {@code prepare*} method.</p>
 */
public abstract class JdbcSchema {

    // stream versions

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamKey)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String streamKey,
            long startVersion) throws SQLException;

    /**
     * Move stream version from start to end version, only when it still is at start version.
     */
    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamKey,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement deleteStreamVersion(Connection connection, String streamKey)
            throws SQLException;

    protected abstract PreparedStatement countStreams(Connection connection) throws SQLException;

    // events

    /**
     * Statement inserting single event, that reports generated global position as generated key.
     */
    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, StoredEvent event) throws SQLException;

    protected abstract long readGeneratedPosition(ResultSet generatedKeys) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String streamKey, long fromVersion,
            long toVersion) throws SQLException;

    protected abstract PreparedStatement selectAllEvents(Connection connection, EventFilter filter,
            long afterPosition, int batchSize) throws SQLException;

    protected abstract StoredEvent readEvent(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement deleteEventsBefore(Connection connection, String streamKey,
            long beforeVersion) throws SQLException;

    protected abstract PreparedStatement deleteEvents(Connection connection, String streamKey) throws SQLException;

    // snapshots

    /**
     * Select snapshots of an aggregate, highest version first.
     */
    protected abstract PreparedStatement selectSnapshots(Connection connection, String aggregateId,
            String aggregateType, int limit) throws SQLException;

    protected abstract long readSnapshotVersion(ResultSet rs) throws SQLException;

    protected abstract Instant readSnapshotTimestamp(ResultSet rs) throws SQLException;

    protected abstract SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException;

    protected abstract String readSnapshotPayload(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, String aggregateId,
            String aggregateType, long version, Instant timestamp, SnapshotMetadata metadata, String payload)
            throws SQLException;

    protected abstract PreparedStatement deleteSnapshot(Connection connection, String aggregateId,
            String aggregateType, long version) throws SQLException;

    /**
     * Delete snapshots of an aggregate with version at or below given one.
     */
    protected abstract PreparedStatement deleteSnapshotsUpTo(Connection connection, String aggregateId,
            String aggregateType, long version) throws SQLException;

    // checkpoints

    protected abstract PreparedStatement selectCheckpoint(Connection connection, String projectionName)
            throws SQLException;

    protected abstract Checkpoint readCheckpoint(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateCheckpoint(Connection connection, Checkpoint checkpoint)
            throws SQLException;

    protected abstract PreparedStatement insertCheckpoint(Connection connection, Checkpoint checkpoint)
            throws SQLException;

    protected abstract PreparedStatement deleteCheckpoint(Connection connection, String projectionName)
            throws SQLException;
}
