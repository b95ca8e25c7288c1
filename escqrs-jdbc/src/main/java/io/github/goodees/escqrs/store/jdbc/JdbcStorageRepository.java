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
import io.github.goodees.escqrs.store.ConcurrencyException;
import io.github.goodees.escqrs.store.EventStoreException;
import io.github.goodees.escqrs.store.StorageRepository;
import io.github.goodees.escqrs.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Storage repository backed by a relational database.
 *
 * <p>Every append is a single transaction: the stream version is read, the events are inserted and the version
 * row is moved from the expected to the new version. When another writer moved the version in between, the update
 * affects no row, or the insert violates the unique (stream, version) constraint. Both cases roll back and surface
 * as {@link ConcurrencyException}.</p>
 */
public class JdbcStorageRepository implements StorageRepository {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageRepository.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcStorageRepository(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, TxHandler.LOCAL);
    }

    public JdbcStorageRepository(DataSource dataSource, JdbcSchema schema, TxHandler txHandler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.txHandler = txHandler;
    }

    @Override
    public List<StoredEvent> saveEvents(String streamKey, List<StoredEvent> events) throws EventStoreException {
        PersistTemplate template = createTemplate(streamKey);
        for (StoredEvent event : events) {
            template.addEvent(event);
        }
        return template.persist();
    }

    protected PersistTemplate createTemplate(String streamKey) {
        return new PersistTemplate(streamKey);
    }

    protected class PersistTemplate {
        private final String streamKey;
        private final List<StoredEvent> events = new ArrayList<>();
        private long startVersion;
        private long endVersion;

        protected PersistTemplate(String streamKey) {
            this.streamKey = streamKey;
        }

        void addEvent(StoredEvent event) throws EventStoreException {
            if (!streamKey.equals(event.getStreamKey())) {
                throw EventStoreException.multipleStreams(streamKey, event.getStreamKey());
            }
            if (events.isEmpty()) {
                startVersion = event.getVersion() - 1;
            } else if (event.getVersion() != endVersion + 1) {
                throw EventStoreException.nonMonotonic(streamKey, endVersion + 1, event.getVersion());
            }
            endVersion = event.getVersion();
            events.add(event);
        }

        public List<StoredEvent> persist() throws EventStoreException {
            if (events.isEmpty()) {
                return Collections.emptyList();
            }
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    checkSourceVersion(connection);
                    List<StoredEvent> saved = storeEvents(connection);
                    updateVersion(connection);
                    txHandler.commit(connection);
                    return saved;
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
            } catch (SQLIntegrityConstraintViolationException e) {
                logger.debug("Constraint violation appending to {}, reporting as concurrent write", streamKey, e);
                throw conflict(getCurrentVersion(streamKey));
            } catch (SQLException e) {
                throw EventStoreException.storeFailed(streamKey, e);
            }
        }

        private void checkSourceVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamKey);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (!rs.next()) {
                    // no stream version - create a new one.
                    if (startVersion != 0) {
                        throw conflict(0);
                    }
                    try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamKey,
                            startVersion)) {
                        createVersion.executeUpdate();
                    }
                } else {
                    long version = schema.readStreamVersion(rs);
                    if (version != startVersion) {
                        throw conflict(version);
                    }
                }
            }
        }

        private List<StoredEvent> storeEvents(Connection connection) throws SQLException {
            List<StoredEvent> saved = new ArrayList<>(events.size());
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                for (StoredEvent event : events) {
                    schema.prepareInsert(insertEvent, event);
                    insertEvent.executeUpdate();
                    try (ResultSet keys = insertEvent.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No position generated for " + event);
                        }
                        saved.add(event.withPosition(schema.readGeneratedPosition(keys)));
                    }
                }
            }
            return saved;
        }

        private void updateVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamKey, startVersion,
                    endVersion)) {
                if (updateVersion.executeUpdate() != 1) {
                    throw conflict(getCurrentVersion(streamKey));
                }
            }
        }

        private ConcurrencyException conflict(long actualVersion) {
            return new ConcurrencyException(events.get(0).getAggregateId(), startVersion, actualVersion);
        }
    }

    @Override
    public List<StoredEvent> getEvents(String streamKey, long fromVersion, long toVersion)
            throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectEvents(connection, streamKey, fromVersion, toVersion)) {
            return readEvents(st);
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events of " + streamKey, e);
        }
    }

    @Override
    public long getCurrentVersion(String streamKey) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectStreamVersion(connection, streamKey);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("version of " + streamKey, e);
        }
    }

    @Override
    public List<StoredEvent> getAllEvents(EventFilter filter, long fromPosition, int batchSize)
            throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectAllEvents(connection, filter, fromPosition, batchSize)) {
            return readEvents(st);
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events after position " + fromPosition, e);
        }
    }

    private List<StoredEvent> readEvents(PreparedStatement st) throws SQLException {
        List<StoredEvent> result = new ArrayList<>();
        try (ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                result.add(schema.readEvent(rs));
            }
        }
        return result;
    }

    @Override
    public int truncateStream(String streamKey, long beforeVersion) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.deleteEventsBefore(connection, streamKey, beforeVersion)) {
            int removed = st.executeUpdate();
            logger.debug("Truncated {} events of {} before version {}", removed, streamKey, beforeVersion);
            return removed;
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(streamKey, e);
        }
    }

    @Override
    public boolean deleteStream(String streamKey) throws EventStoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try (PreparedStatement deleteEvents = schema.deleteEvents(connection, streamKey);
                    PreparedStatement deleteVersion = schema.deleteStreamVersion(connection, streamKey)) {
                deleteEvents.executeUpdate();
                boolean existed = deleteVersion.executeUpdate() > 0;
                txHandler.commit(connection);
                return existed;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(streamKey, e);
        }
    }

    @Override
    public long streamCount() throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.countStreams(connection);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("stream count", e);
        }
    }
}
