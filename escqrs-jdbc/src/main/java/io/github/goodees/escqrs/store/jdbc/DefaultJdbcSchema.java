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
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * JDBC schema using standard SQL. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(GLOBAL_POSITION identity, EVENT_ID, STREAM_KEY, AGGREGATE_ID, AGGREGATE_TYPE,
 * STREAM_VERSION, EVENT_TYPE, PAYLOAD, METADATA, CREATED_AT) unique (STREAM_KEY, STREAM_VERSION)</li>
 * <li><em>streamTable</em>(STREAM_KEY, STREAM_VERSION) primary key (STREAM_KEY)</li>
 * <li><em>snapshotTable</em>(AGGREGATE_ID, AGGREGATE_TYPE, SNAPSHOT_VERSION, CREATED_AT, CHECKSUM, STATE_SIZE,
 * COMPRESSION, SERIALIZATION_FORMAT, PAYLOAD) primary key (AGGREGATE_TYPE, AGGREGATE_ID, SNAPSHOT_VERSION)</li>
 * <li><em>checkpointTable</em>(PROJECTION_NAME, GLOBAL_POSITION, UPDATED_AT) primary key (PROJECTION_NAME)</li>
 * </ul>
 * {@link #createStatements()} lists DDL creating them.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "GLOBAL_POSITION, EVENT_ID, STREAM_KEY, AGGREGATE_ID, "
            + "AGGREGATE_TYPE, STREAM_VERSION, EVENT_TYPE, PAYLOAD, METADATA, CREATED_AT";

    private final String eventTable;
    private final String streamTable;
    private final String snapshotTable;
    private final String checkpointTable;

    public DefaultJdbcSchema() {
        this("ES_EVENT", "ES_STREAM", "ES_SNAPSHOT", "ES_CHECKPOINT");
    }

    public DefaultJdbcSchema(String eventTable, String streamTable, String snapshotTable, String checkpointTable) {
        this.eventTable = eventTable;
        this.streamTable = streamTable;
        this.snapshotTable = snapshotTable;
        this.checkpointTable = checkpointTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getStreamTable() {
        return streamTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    protected String getCheckpointTable() {
        return checkpointTable;
    }

    /**
     * DDL of the tables, valid for databases supporting SQL:2003 identity columns (H2, PostgreSQL, Oracle 12+,
     * DB2).
     * @return create table statements
     */
    public List<String> createStatements() {
        return Arrays.asList(
                "CREATE TABLE " + getEventTable() + " (GLOBAL_POSITION BIGINT GENERATED BY DEFAULT AS IDENTITY "
                        + "PRIMARY KEY, EVENT_ID VARCHAR(64) NOT NULL UNIQUE, STREAM_KEY VARCHAR(512) NOT NULL, "
                        + "AGGREGATE_ID VARCHAR(255) NOT NULL, AGGREGATE_TYPE VARCHAR(255) NOT NULL, "
                        + "STREAM_VERSION BIGINT NOT NULL, EVENT_TYPE VARCHAR(255) NOT NULL, PAYLOAD CLOB, "
                        + "METADATA CLOB, CREATED_AT TIMESTAMP(9) NOT NULL, "
                        + "CONSTRAINT " + getEventTable() + "_STREAM_UK UNIQUE (STREAM_KEY, STREAM_VERSION))",
                "CREATE TABLE " + getStreamTable() + " (STREAM_KEY VARCHAR(512) PRIMARY KEY, "
                        + "STREAM_VERSION BIGINT NOT NULL)",
                "CREATE TABLE " + getSnapshotTable() + " (AGGREGATE_ID VARCHAR(255) NOT NULL, "
                        + "AGGREGATE_TYPE VARCHAR(255) NOT NULL, SNAPSHOT_VERSION BIGINT NOT NULL, "
                        + "CREATED_AT TIMESTAMP(9) NOT NULL, CHECKSUM VARCHAR(64), STATE_SIZE BIGINT, "
                        + "COMPRESSION VARCHAR(32), SERIALIZATION_FORMAT VARCHAR(32), PAYLOAD CLOB, "
                        + "PRIMARY KEY (AGGREGATE_TYPE, AGGREGATE_ID, SNAPSHOT_VERSION))",
                "CREATE TABLE " + getCheckpointTable() + " (PROJECTION_NAME VARCHAR(255) PRIMARY KEY, "
                        + "GLOBAL_POSITION BIGINT NOT NULL, UPDATED_AT TIMESTAMP(9) NOT NULL)");
    }

    public List<String> dropStatements() {
        return Arrays.asList("DROP TABLE " + getEventTable(), "DROP TABLE " + getStreamTable(),
                "DROP TABLE " + getSnapshotTable(), "DROP TABLE " + getCheckpointTable());
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamKey) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_VERSION FROM " + getStreamTable()
                + " WHERE STREAM_KEY=?");
        st.setString(1, streamKey);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String streamKey, long startVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getStreamTable()
                + " (STREAM_KEY, STREAM_VERSION) VALUES (?, ?)");
        st.setString(1, streamKey);
        st.setLong(2, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamKey, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getStreamTable()
                + " SET STREAM_VERSION=? WHERE STREAM_KEY=? AND STREAM_VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, streamKey);
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement deleteStreamVersion(Connection connection, String streamKey) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getStreamTable() + " WHERE STREAM_KEY=?");
        st.setString(1, streamKey);
        return st;
    }

    @Override
    protected PreparedStatement countStreams(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT COUNT(*) FROM " + getStreamTable() + " WHERE STREAM_VERSION > 0");
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (EVENT_ID, STREAM_KEY, AGGREGATE_ID, AGGREGATE_TYPE, STREAM_VERSION, EVENT_TYPE, PAYLOAD, "
                + "METADATA, CREATED_AT) VALUES (?,?,?,?,?,?,?,?,?)", new String[] {"GLOBAL_POSITION"});
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, StoredEvent event) throws SQLException {
        insertEvent.setString(1, event.getEventId());
        insertEvent.setString(2, event.getStreamKey());
        insertEvent.setString(3, event.getAggregateId());
        insertEvent.setString(4, event.getAggregateType());
        insertEvent.setLong(5, event.getVersion());
        insertEvent.setString(6, event.getEventType());
        insertEvent.setString(7, event.getPayload());
        insertEvent.setString(8, event.getMetadata());
        insertEvent.setTimestamp(9, Timestamp.from(event.getTimestamp()));
    }

    @Override
    protected long readGeneratedPosition(ResultSet generatedKeys) throws SQLException {
        return generatedKeys.getLong(1);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamKey, long fromVersion,
            long toVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE STREAM_KEY=? AND STREAM_VERSION >= ? AND STREAM_VERSION <= ? ORDER BY STREAM_VERSION");
        st.setString(1, streamKey);
        st.setLong(2, fromVersion);
        st.setLong(3, toVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectAllEvents(Connection connection, EventFilter filter, long afterPosition,
            int batchSize) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS).append(" FROM ")
                .append(getEventTable()).append(" WHERE GLOBAL_POSITION > ?");
        List<Object> params = new ArrayList<>();
        params.add(afterPosition);
        in(sql, params, "EVENT_TYPE", filter.getEventTypes());
        in(sql, params, "AGGREGATE_TYPE", filter.getAggregateTypes());
        in(sql, params, "AGGREGATE_ID", filter.getAggregateIds());
        if (filter.getFrom() != null) {
            sql.append(" AND CREATED_AT >= ?");
            params.add(Timestamp.from(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND CREATED_AT <= ?");
            params.add(Timestamp.from(filter.getTo()));
        }
        sql.append(" ORDER BY GLOBAL_POSITION FETCH FIRST ? ROWS ONLY");
        params.add(batchSize);

        PreparedStatement st = connection.prepareStatement(sql.toString());
        for (int i = 0; i < params.size(); i++) {
            st.setObject(i + 1, params.get(i));
        }
        return st;
    }

    private static void in(StringBuilder sql, List<Object> params, String column, Collection<String> values) {
        if (values.isEmpty()) {
            return;
        }
        sql.append(" AND ").append(column).append(" IN (");
        boolean first = true;
        for (String value : values) {
            sql.append(first ? "?" : ",?");
            params.add(value);
            first = false;
        }
        sql.append(')');
    }

    @Override
    protected StoredEvent readEvent(ResultSet rs) throws SQLException {
        return new StoredEvent(rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getLong(6),
                rs.getString(7), rs.getString(8), rs.getString(9), rs.getTimestamp(10).toInstant(), rs.getLong(1));
    }

    @Override
    protected PreparedStatement deleteEventsBefore(Connection connection, String streamKey, long beforeVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getEventTable()
                + " WHERE STREAM_KEY=? AND STREAM_VERSION < ?");
        st.setString(1, streamKey);
        st.setLong(2, beforeVersion);
        return st;
    }

    @Override
    protected PreparedStatement deleteEvents(Connection connection, String streamKey) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getEventTable() + " WHERE STREAM_KEY=?");
        st.setString(1, streamKey);
        return st;
    }

    @Override
    protected PreparedStatement selectSnapshots(Connection connection, String aggregateId, String aggregateType,
            int limit) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT SNAPSHOT_VERSION, CREATED_AT, CHECKSUM, "
                + "STATE_SIZE, COMPRESSION, SERIALIZATION_FORMAT, PAYLOAD FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_TYPE=? AND AGGREGATE_ID=? ORDER BY SNAPSHOT_VERSION DESC FETCH FIRST ? ROWS ONLY");
        ps.setString(1, aggregateType);
        ps.setString(2, aggregateId);
        ps.setInt(3, limit);
        return ps;
    }

    @Override
    protected long readSnapshotVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected Instant readSnapshotTimestamp(ResultSet rs) throws SQLException {
        return rs.getTimestamp(2).toInstant();
    }

    @Override
    protected SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException {
        return new SnapshotMetadata(rs.getString(3), rs.getLong(4), rs.getString(5), rs.getString(6));
    }

    @Override
    protected String readSnapshotPayload(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, String aggregateId, String aggregateType,
            long version, Instant timestamp, SnapshotMetadata metadata, String payload) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (AGGREGATE_ID, AGGREGATE_TYPE, SNAPSHOT_VERSION, CREATED_AT, CHECKSUM, STATE_SIZE, COMPRESSION, "
                + "SERIALIZATION_FORMAT, PAYLOAD) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)");
        ps.setString(1, aggregateId);
        ps.setString(2, aggregateType);
        ps.setLong(3, version);
        ps.setTimestamp(4, Timestamp.from(timestamp));
        ps.setString(5, metadata.getChecksum());
        ps.setLong(6, metadata.getSize());
        ps.setString(7, metadata.getCompression());
        ps.setString(8, metadata.getSerializationFormat());
        ps.setString(9, payload);
        return ps;
    }

    @Override
    protected PreparedStatement deleteSnapshot(Connection connection, String aggregateId, String aggregateType,
            long version) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_TYPE=? AND AGGREGATE_ID=? AND SNAPSHOT_VERSION=?");
        ps.setString(1, aggregateType);
        ps.setString(2, aggregateId);
        ps.setLong(3, version);
        return ps;
    }

    @Override
    protected PreparedStatement deleteSnapshotsUpTo(Connection connection, String aggregateId, String aggregateType,
            long version) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_TYPE=? AND AGGREGATE_ID=? AND SNAPSHOT_VERSION <= ?");
        ps.setString(1, aggregateType);
        ps.setString(2, aggregateId);
        ps.setLong(3, version);
        return ps;
    }

    @Override
    protected PreparedStatement selectCheckpoint(Connection connection, String projectionName) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT PROJECTION_NAME, GLOBAL_POSITION, UPDATED_AT FROM "
                + getCheckpointTable() + " WHERE PROJECTION_NAME=?");
        ps.setString(1, projectionName);
        return ps;
    }

    @Override
    protected Checkpoint readCheckpoint(ResultSet rs) throws SQLException {
        return Checkpoint.of(rs.getString(1), rs.getLong(2), rs.getTimestamp(3).toInstant());
    }

    @Override
    protected PreparedStatement updateCheckpoint(Connection connection, Checkpoint checkpoint) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getCheckpointTable()
                + " SET GLOBAL_POSITION=?, UPDATED_AT=? WHERE PROJECTION_NAME=?");
        ps.setLong(1, checkpoint.getPosition());
        ps.setTimestamp(2, Timestamp.from(checkpoint.getTimestamp()));
        ps.setString(3, checkpoint.getProjectionName());
        return ps;
    }

    @Override
    protected PreparedStatement insertCheckpoint(Connection connection, Checkpoint checkpoint) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getCheckpointTable()
                + " (PROJECTION_NAME, GLOBAL_POSITION, UPDATED_AT) VALUES (?, ?, ?)");
        ps.setString(1, checkpoint.getProjectionName());
        ps.setLong(2, checkpoint.getPosition());
        ps.setTimestamp(3, Timestamp.from(checkpoint.getTimestamp()));
        return ps;
    }

    @Override
    protected PreparedStatement deleteCheckpoint(Connection connection, String projectionName) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getCheckpointTable()
                + " WHERE PROJECTION_NAME=?");
        ps.setString(1, projectionName);
        return ps;
    }
}
