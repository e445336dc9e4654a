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

/**
 * SQL dialect and table layout of {@link JdbcEventStore}. Statements are returned prepared with their parameters,
 * the store executes and closes them.
 */
public abstract class JdbcSchema {

    /**
     * Stored event with its payload and metadata still serialized.
     */
    public static final class StoredEvent {
        private final RecordedEvent.Builder event;
        private final String payload;
        private final String metadata;
        private final long batchStart;

        public StoredEvent(RecordedEvent.Builder event, String payload, String metadata, long batchStart) {
            this.event = event;
            this.payload = payload;
            this.metadata = metadata;
            this.batchStart = batchStart;
        }

        public RecordedEvent.Builder getEvent() {
            return event;
        }

        public String getPayload() {
            return payload;
        }

        public String getMetadata() {
            return metadata;
        }

        /**
         * @return event number of the first event of the same append
         */
        public long getBatchStart() {
            return batchStart;
        }
    }

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamId, boolean forUpdate)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createStream(Connection connection, String streamId) throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement selectLastEventNumber(Connection connection, boolean forUpdate)
            throws SQLException;

    protected abstract long readLastEventNumber(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateLastEventNumber(Connection connection, long expected, long newValue)
            throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, RecordedEvent event, String payload,
            String metadata, long batchStart) throws SQLException;

    /**
     * Events of one stream, starting at given version, in version order.
     */
    protected abstract PreparedStatement selectStreamEvents(Connection connection, String streamId, long fromVersion,
            int limit) throws SQLException;

    /**
     * Events of all streams with event number greater than given, in event number order.
     */
    protected abstract PreparedStatement selectEventsAfter(Connection connection, long afterEventNumber, int limit)
            throws SQLException;

    /**
     * Rest of an append, events of given batch after given event number, in order.
     */
    protected abstract PreparedStatement selectBatchRest(Connection connection, long batchStart,
            long afterEventNumber) throws SQLException;

    protected abstract StoredEvent readEvent(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement selectSnapshot(Connection connection, String sourceId) throws SQLException;

    /**
     * @return snapshot, whose data is serialized payload, without metadata
     */
    protected abstract SnapshotData readSnapshot(ResultSet rs) throws SQLException;

    protected abstract String readSnapshotMetadata(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateSnapshot(Connection connection, SnapshotData snapshot, String payload,
            String metadata) throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, SnapshotData snapshot, String payload,
            String metadata) throws SQLException;

    protected abstract PreparedStatement deleteSnapshot(Connection connection, String sourceId) throws SQLException;
}
