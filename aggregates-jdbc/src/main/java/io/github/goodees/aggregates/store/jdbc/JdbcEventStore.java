package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates-jdbc
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.aggregates.serialization.JsonSerialization;
import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.EventStream;
import io.github.goodees.aggregates.store.ExpectedVersion;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.Serialization;
import io.github.goodees.aggregates.store.SnapshotData;
import io.github.goodees.aggregates.store.StartFrom;
import io.github.goodees.aggregates.store.Subscriber;
import io.github.goodees.aggregates.store.Subscription;
import io.github.goodees.aggregates.subscription.EventHistory;
import io.github.goodees.aggregates.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Event store in relational database.
 *
 * <p>An append runs in single transaction: it locks the stream's version row, checks the expected version, locks
 * the global event counter, inserts the events and moves both the stream version and the counter. The version
 * update is conditional, so a concurrent append that slipped through fails on optimistic lock. After commit the
 * append is passed to subscriptions of this store instance.</p>
 *
 * <p>Subscriptions are kept in memory of this instance. Appends committed by other instances on the same database
 * are read from the events table when an own append skips over them, or when {@link #pollSubscriptions()} is
 * called. Durable subscriptions read their history from the database.</p>
 */
public class JdbcEventStore implements EventStore, EventHistory {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<Map<String, String>>() {
    };

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization serialization;
    private final TxHandler txHandler;
    private final ObjectMapper metadataMapper = JsonSerialization.createMapper();
    private final SubscriptionManager subscriptions;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization serialization) {
        this(dataSource, schema, serialization, LOCAL_HANDLER, SubscriptionManager.sharedDeliveryExecutor());
    }

    /**
     * Create the store. Reads the event counter, so the tables must exist.
     * @param dataSource the database
     * @param schema table layout
     * @param serialization payload serialization
     * @param handler transaction handling
     * @param deliveryExecutor executor running subscription notifications
     */
    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization serialization, TxHandler handler,
            ExecutorService deliveryExecutor) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.serialization = Objects.requireNonNull(serialization, "serialization");
        this.txHandler = Objects.requireNonNull(handler, "handler");
        long lastEventNumber;
        try {
            lastEventNumber = currentPosition(ALL_STREAMS);
        } catch (EventStoreException e) {
            throw new IllegalStateException("Cannot read event counter", e);
        }
        this.subscriptions = new SubscriptionManager("jdbc", this, deliveryExecutor, lastEventNumber);
    }

    @Override
    public void appendToStream(String streamId, ExpectedVersion expectedVersion, List<EventData> events)
            throws EventStoreException {
        checkStreamId(streamId);
        Objects.requireNonNull(expectedVersion, "expectedVersion");
        Objects.requireNonNull(events, "events");
        if (ALL_STREAMS.equals(streamId)) {
            throw EventStoreException.reservedStream(streamId);
        }
        List<String> payloads = new ArrayList<>(events.size());
        List<String> metadata = new ArrayList<>(events.size());
        for (EventData event : events) {
            try {
                payloads.add(serialization.serialize(event.getData()));
            } catch (IllegalArgumentException e) {
                throw EventStoreException.unsupported(streamId, event.getData(), e);
            }
            metadata.add(writeMetadata(streamId, event.getMetadata()));
        }
        List<RecordedEvent> committed;
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                committed = append(connection, streamId, expectedVersion, events, payloads, metadata);
                txHandler.commit(connection);
            } catch (SQLException | EventStoreException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                // concurrent append created the stream or took the versions
                logger.debug("Append to {} collided with concurrent append", streamId, e);
                throw EventStoreException.wrongExpectedVersion(streamId, expectedVersion, -1);
            }
            throw EventStoreException.storeFailed(streamId, e);
        }
        if (!committed.isEmpty() && txHandler.commitsOnReturn()) {
            subscriptions.publish(committed);
        }
    }

    /**
     * Deliver appends committed since the last delivery, including those of other store instances and those whose
     * transaction was committed by the container.
     * @throws EventStoreException when reading the events fails
     */
    public void pollSubscriptions() throws EventStoreException {
        subscriptions.refresh();
    }

    private List<RecordedEvent> append(Connection connection, String streamId, ExpectedVersion expectedVersion,
            List<EventData> events, List<String> payloads, List<String> metadata)
            throws SQLException, EventStoreException {
        long version;
        boolean exists;
        try (PreparedStatement select = schema.selectStreamVersion(connection, streamId, true);
                ResultSet rs = select.executeQuery()) {
            exists = rs.next();
            version = exists ? schema.readStreamVersion(rs) : 0;
        }
        if (!expectedVersion.matches(version)) {
            throw EventStoreException.wrongExpectedVersion(streamId, expectedVersion, version);
        }
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        if (!exists) {
            try (PreparedStatement create = schema.createStream(connection, streamId)) {
                create.executeUpdate();
            }
        }
        long lastEventNumber;
        try (PreparedStatement select = schema.selectLastEventNumber(connection, true);
                ResultSet rs = select.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("Event counter row is missing");
            }
            lastEventNumber = schema.readLastEventNumber(rs);
        }
        // database timestamps may not keep nanoseconds
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long batchStart = lastEventNumber + 1;
        List<RecordedEvent> recorded = new ArrayList<>(events.size());
        try (PreparedStatement insert = schema.insertEvent(connection)) {
            for (int i = 0; i < events.size(); i++) {
                RecordedEvent event = RecordedEvent.builder()
                        .from(events.get(i))
                        .eventId(UUID.randomUUID())
                        .streamId(streamId)
                        .streamVersion(version + i)
                        .eventNumber(batchStart + i)
                        .createdAt(now)
                        .build();
                schema.prepareInsert(insert, event, payloads.get(i), metadata.get(i), batchStart);
                insert.addBatch();
                recorded.add(event);
            }
            insert.executeBatch();
        }
        try (PreparedStatement update = schema.updateStreamVersion(connection, streamId, version,
                version + events.size())) {
            if (update.executeUpdate() != 1) {
                throw EventStoreException.concurrentAppend(streamId, version);
            }
        }
        try (PreparedStatement update = schema.updateLastEventNumber(connection, lastEventNumber,
                lastEventNumber + events.size())) {
            if (update.executeUpdate() != 1) {
                throw new SQLException("Event counter moved during append to " + streamId);
            }
        }
        return Collections.unmodifiableList(recorded);
    }

    @Override
    public EventStream streamForward(String streamId, long startVersion, int batchSize) throws EventStoreException {
        checkStreamId(streamId);
        if (streamVersion(streamId) == 0) {
            throw EventStoreException.streamNotFound(streamId);
        }
        return new EventStream(streamId, startVersion, batchSize, (from, max) -> {
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement select = schema.selectStreamEvents(connection, streamId, from, max);
                    ResultSet rs = select.executeQuery()) {
                List<RecordedEvent> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(decode(schema.readEvent(rs)));
                }
                return result;
            } catch (SQLException e) {
                throw EventStoreException.storeFailed(streamId, e);
            }
        });
    }

    @Override
    public List<List<RecordedEvent>> readBatches(String streamId, long afterPosition, int maxEvents)
            throws EventStoreException {
        boolean all = ALL_STREAMS.equals(streamId);
        try (Connection connection = dataSource.getConnection()) {
            List<JdbcSchema.StoredEvent> rows = new ArrayList<>();
            try (PreparedStatement select = all
                    ? schema.selectEventsAfter(connection, afterPosition, maxEvents)
                    : schema.selectStreamEvents(connection, streamId, afterPosition, maxEvents);
                    ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    rows.add(schema.readEvent(rs));
                }
            }
            if (rows.size() == maxEvents) {
                JdbcSchema.StoredEvent last = rows.get(rows.size() - 1);
                long lastNumber = last.getEvent().build().getEventNumber();
                try (PreparedStatement select = schema.selectBatchRest(connection, last.getBatchStart(), lastNumber);
                        ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        rows.add(schema.readEvent(rs));
                    }
                }
            }
            List<List<RecordedEvent>> batches = new ArrayList<>();
            List<RecordedEvent> current = null;
            long currentStart = -1;
            for (JdbcSchema.StoredEvent row : rows) {
                if (current == null || row.getBatchStart() != currentStart) {
                    current = new ArrayList<>();
                    currentStart = row.getBatchStart();
                    batches.add(current);
                }
                current.add(decode(row));
            }
            return batches;
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(streamId, e);
        }
    }

    @Override
    public long currentPosition(String streamId) throws EventStoreException {
        if (!ALL_STREAMS.equals(streamId)) {
            return streamVersion(streamId);
        }
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectLastEventNumber(connection, false);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readLastEventNumber(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(streamId, e);
        }
    }

    /**
     * @param streamId the stream
     * @return number of events in the stream, 0 for unknown stream
     * @throws EventStoreException when the query fails
     */
    public long streamVersion(String streamId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectStreamVersion(connection, streamId, false);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(streamId, e);
        }
    }

    @Override
    public Subscription subscribe(String streamId, Subscriber subscriber) {
        return subscriptions.subscribe(streamId, subscriber);
    }

    @Override
    public Subscription subscribeTo(String streamId, String name, Subscriber subscriber, StartFrom startFrom)
            throws EventStoreException {
        return subscriptions.subscribeTo(streamId, name, subscriber, startFrom);
    }

    @Override
    public void ackEvent(Subscription subscription, RecordedEvent event) {
        subscriptions.ackEvent(subscription, event);
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        subscriptions.unsubscribe(subscription);
    }

    @Override
    public void deleteSubscription(String streamId, String name) throws EventStoreException {
        subscriptions.deleteSubscription(streamId, name);
    }

    @Override
    public SnapshotData readSnapshot(String sourceId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectSnapshot(connection, sourceId);
                ResultSet rs = select.executeQuery()) {
            if (!rs.next()) {
                throw EventStoreException.snapshotNotFound(sourceId);
            }
            SnapshotData stored = schema.readSnapshot(rs);
            Map<String, String> metadata = readMetadata(sourceId, schema.readSnapshotMetadata(rs));
            Object data = serialization.deserialize((String) stored.getData(), stored.getSourceType());
            return new SnapshotData(stored.getSourceId(), stored.getSourceVersion(), stored.getSourceType(), data,
                    metadata, stored.getCreatedAt());
        } catch (SQLException | IllegalArgumentException e) {
            throw EventStoreException.storeFailed(sourceId, e);
        }
    }

    @Override
    public void recordSnapshot(SnapshotData snapshot) throws EventStoreException {
        Objects.requireNonNull(snapshot, "snapshot");
        String sourceId = snapshot.getSourceId();
        String payload;
        try {
            payload = serialization.serialize(snapshot.getData());
        } catch (IllegalArgumentException e) {
            throw EventStoreException.unsupported(sourceId, snapshot.getData(), e);
        }
        String metadata = writeMetadata(sourceId, snapshot.getMetadata());
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                int updated;
                try (PreparedStatement update = schema.updateSnapshot(connection, snapshot, payload, metadata)) {
                    updated = update.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement insert = schema.insertSnapshot(connection, snapshot, payload, metadata)) {
                        insert.executeUpdate();
                    }
                }
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(sourceId, e);
        }
    }

    @Override
    public void deleteSnapshot(String sourceId) throws EventStoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try (PreparedStatement delete = schema.deleteSnapshot(connection, sourceId)) {
                delete.executeUpdate();
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(sourceId, e);
        }
    }

    private RecordedEvent decode(JdbcSchema.StoredEvent row) throws EventStoreException {
        RecordedEvent.Builder builder = row.getEvent();
        RecordedEvent event = builder.build();
        try {
            return builder
                    .data(serialization.deserialize(row.getPayload(), event.getEventType()))
                    .metadata(readMetadata(event.getStreamId(), row.getMetadata()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw EventStoreException.storeFailed(event.getStreamId(), e);
        }
    }

    private String writeMetadata(String streamId, Map<String, String> metadata) throws EventStoreException {
        if (metadata.isEmpty()) {
            return null;
        }
        try {
            return metadataMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw EventStoreException.unsupported(streamId, metadata, e);
        }
    }

    private Map<String, String> readMetadata(String streamId, String metadata) throws EventStoreException {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return metadataMapper.readValue(metadata, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw EventStoreException.storeFailed(streamId, e);
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex instanceof SQLIntegrityConstraintViolationException || "23505".equals(ex.getSQLState())) {
                return true;
            }
            if (ex instanceof BatchUpdateException && ex.getCause() instanceof SQLException
                    && isConstraintViolation((SQLException) ex.getCause())) {
                return true;
            }
        }
        return false;
    }

    private static void checkStreamId(String streamId) {
        if (streamId == null || streamId.isEmpty()) {
            throw new IllegalArgumentException("Stream id must not be empty");
        }
    }

    /**
     * Transaction demarcation of store operations.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;

        /**
         * @return true when the work is committed once {@link #commit(Connection)} returns, so an append may be
         *     delivered to subscribers right away
         */
        default boolean commitsOnReturn() {
            return true;
        }
    }

    /**
     * Local transactions. Each operation commits on its own.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
            connection.setAutoCommit(true);
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
            connection.setAutoCommit(true);
        }
    };

    /**
     * Transactions managed by container. The store cannot tell whether the surrounding transaction commits, so appends
     * reach subscribers only through {@link JdbcEventStore#pollSubscriptions()}.
     */
    public static final TxHandler CONTAINER_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }

        @Override
        public boolean commitsOnReturn() {
            return false;
        }
    };
}
