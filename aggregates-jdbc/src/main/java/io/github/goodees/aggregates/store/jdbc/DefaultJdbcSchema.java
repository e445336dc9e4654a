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

import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.SnapshotData;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Collections;
import java.util.UUID;

/**
 * JDBC schema using standard SQL with {@code LIMIT} and {@code FOR UPDATE}. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(EVENT_NUMBER, EVENT_ID, STREAM_ID, STREAM_VERSION, BATCH_START, EVENT_TYPE, CAUSATION_ID,
 * CORRELATION_ID, PAYLOAD, METADATA, CREATED_AT) primary key (EVENT_NUMBER), unique (STREAM_ID, STREAM_VERSION)</li>
 * <li><em>streamTable</em>(STREAM_ID, STREAM_VERSION) primary key (STREAM_ID)</li>
 * <li><em>counterTable</em>(ID, LAST_EVENT_NUMBER) with single row of ID 1</li>
 * <li><em>snapshotTable</em>(SOURCE_ID, SOURCE_VERSION, SOURCE_TYPE, PAYLOAD, METADATA, CREATED_AT) primary key
 * (SOURCE_ID)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "EVENT_NUMBER, EVENT_ID, STREAM_ID, STREAM_VERSION, BATCH_START, "
            + "EVENT_TYPE, CAUSATION_ID, CORRELATION_ID, PAYLOAD, METADATA, CREATED_AT";

    private final String eventTable;
    private final String streamTable;
    private final String counterTable;
    private final String snapshotTable;

    public DefaultJdbcSchema(String eventTable, String streamTable, String counterTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.streamTable = streamTable;
        this.counterTable = counterTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getStreamTable() {
        return streamTable;
    }

    protected String getCounterTable() {
        return counterTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamId, boolean forUpdate)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_VERSION FROM " + getStreamTable()
                + " WHERE STREAM_ID=?" + (forUpdate ? " FOR UPDATE" : ""));
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createStream(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getStreamTable()
                + " (STREAM_ID, STREAM_VERSION) VALUES (?, 0)");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long expectedVersion,
            long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getStreamTable()
                + " SET STREAM_VERSION=? WHERE STREAM_ID=? AND STREAM_VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, streamId);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectLastEventNumber(Connection connection, boolean forUpdate) throws SQLException {
        return connection.prepareStatement("SELECT LAST_EVENT_NUMBER FROM " + getCounterTable() + " WHERE ID=1"
                + (forUpdate ? " FOR UPDATE" : ""));
    }

    @Override
    protected long readLastEventNumber(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateLastEventNumber(Connection connection, long expected, long newValue)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getCounterTable()
                + " SET LAST_EVENT_NUMBER=? WHERE ID=1 AND LAST_EVENT_NUMBER=?");
        st.setLong(1, newValue);
        st.setLong(2, expected);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable() + " (" + EVENT_COLUMNS
                + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, RecordedEvent event, String payload, String metadata,
            long batchStart) throws SQLException {
        insertEvent.setLong(1, event.getEventNumber());
        insertEvent.setString(2, event.getEventId().toString());
        insertEvent.setString(3, event.getStreamId());
        insertEvent.setLong(4, event.getStreamVersion());
        insertEvent.setLong(5, batchStart);
        insertEvent.setString(6, event.getEventType());
        setUuid(insertEvent, 7, event.getCausationId());
        setUuid(insertEvent, 8, event.getCorrelationId());
        insertEvent.setString(9, payload);
        insertEvent.setString(10, metadata);
        insertEvent.setTimestamp(11, Timestamp.from(event.getCreatedAt()));
    }

    @Override
    protected PreparedStatement selectStreamEvents(Connection connection, String streamId, long fromVersion,
            int limit) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE STREAM_ID=? AND STREAM_VERSION >= ? ORDER BY STREAM_VERSION LIMIT ?");
        st.setString(1, streamId);
        st.setLong(2, fromVersion);
        st.setInt(3, limit);
        return st;
    }

    @Override
    protected PreparedStatement selectEventsAfter(Connection connection, long afterEventNumber, int limit)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE EVENT_NUMBER > ? ORDER BY EVENT_NUMBER LIMIT ?");
        st.setLong(1, afterEventNumber);
        st.setInt(2, limit);
        return st;
    }

    @Override
    protected PreparedStatement selectBatchRest(Connection connection, long batchStart, long afterEventNumber)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE BATCH_START=? AND EVENT_NUMBER > ? ORDER BY EVENT_NUMBER");
        st.setLong(1, batchStart);
        st.setLong(2, afterEventNumber);
        return st;
    }

    @Override
    protected StoredEvent readEvent(ResultSet rs) throws SQLException {
        RecordedEvent.Builder event = RecordedEvent.builder()
                .eventNumber(rs.getLong(1))
                .eventId(UUID.fromString(rs.getString(2)))
                .streamId(rs.getString(3))
                .streamVersion(rs.getLong(4))
                .eventType(rs.getString(6))
                .causationId(readUuid(rs, 7))
                .correlationId(readUuid(rs, 8))
                .createdAt(rs.getTimestamp(11).toInstant());
        return new StoredEvent(event, rs.getString(9), rs.getString(10), rs.getLong(5));
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String sourceId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT SOURCE_ID, SOURCE_VERSION, SOURCE_TYPE, PAYLOAD, "
                + "METADATA, CREATED_AT FROM " + getSnapshotTable() + " WHERE SOURCE_ID=?");
        st.setString(1, sourceId);
        return st;
    }

    @Override
    protected SnapshotData readSnapshot(ResultSet rs) throws SQLException {
        return new SnapshotData(rs.getString(1), rs.getLong(2), rs.getString(3), rs.getString(4),
                Collections.emptyMap(), rs.getTimestamp(6).toInstant());
    }

    @Override
    protected String readSnapshotMetadata(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, SnapshotData snapshot, String payload,
            String metadata) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET SOURCE_VERSION=?, SOURCE_TYPE=?, PAYLOAD=?, METADATA=?, CREATED_AT=? WHERE SOURCE_ID=?");
        st.setLong(1, snapshot.getSourceVersion());
        st.setString(2, snapshot.getSourceType());
        st.setString(3, payload);
        st.setString(4, metadata);
        st.setTimestamp(5, Timestamp.from(snapshot.getCreatedAt()));
        st.setString(6, snapshot.getSourceId());
        return st;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, SnapshotData snapshot, String payload,
            String metadata) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (SOURCE_ID, SOURCE_VERSION, SOURCE_TYPE, PAYLOAD, METADATA, CREATED_AT) VALUES (?,?,?,?,?,?)");
        st.setString(1, snapshot.getSourceId());
        st.setLong(2, snapshot.getSourceVersion());
        st.setString(3, snapshot.getSourceType());
        st.setString(4, payload);
        st.setString(5, metadata);
        st.setTimestamp(6, Timestamp.from(snapshot.getCreatedAt()));
        return st;
    }

    @Override
    protected PreparedStatement deleteSnapshot(Connection connection, String sourceId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getSnapshotTable() + " WHERE SOURCE_ID=?");
        st.setString(1, sourceId);
        return st;
    }

    private static void setUuid(PreparedStatement st, int index, UUID value) throws SQLException {
        if (value == null) {
            st.setNull(index, Types.VARCHAR);
        } else {
            st.setString(index, value.toString());
        }
    }

    private static UUID readUuid(ResultSet rs, int index) throws SQLException {
        String value = rs.getString(index);
        return value == null ? null : UUID.fromString(value);
    }
}
