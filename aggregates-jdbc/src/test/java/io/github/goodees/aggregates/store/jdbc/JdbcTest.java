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

import io.github.goodees.aggregates.serialization.JsonSerialization;
import io.github.goodees.aggregates.store.EventData;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class JdbcTest {
    protected static JdbcDataSource ds;
    protected static JdbcTemplate template;
    @Rule
    public TestName testName = new TestName();
    protected DefaultJdbcSchema schema;
    protected JsonSerialization serialization;
    protected JdbcEventStore eventStore;

    @BeforeClass
    public static void initDb() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:aggtest;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        try (Connection con = ds.getConnection()) {
            executeSql(con,
                "create table events (EVENT_NUMBER bigint primary key, EVENT_ID varchar(36) not null, "
                        + "STREAM_ID varchar(200) not null, STREAM_VERSION bigint not null, BATCH_START bigint not null, "
                        + "EVENT_TYPE varchar(200) not null, CAUSATION_ID varchar(36), CORRELATION_ID varchar(36), "
                        + "PAYLOAD clob, METADATA varchar(4000), CREATED_AT timestamp not null, "
                        + "unique (STREAM_ID, STREAM_VERSION))",
                "create index events_batch on events (BATCH_START)",
                "create table streams (STREAM_ID varchar(200) primary key, STREAM_VERSION bigint not null)",
                "create table event_counter (ID int primary key, LAST_EVENT_NUMBER bigint not null)",
                "insert into event_counter (ID, LAST_EVENT_NUMBER) values (1, 0)",
                "create table snapshots (SOURCE_ID varchar(200) primary key, SOURCE_VERSION bigint not null, "
                        + "SOURCE_TYPE varchar(200) not null, PAYLOAD clob, METADATA varchar(4000), "
                        + "CREATED_AT timestamp not null)");
        }
        template = new JdbcTemplate(ds);
    }

    @AfterClass
    public static void dropDb() throws SQLException {
        try (Connection con = ds.getConnection()) {
            executeSql(con, "drop table events", "drop table streams", "drop table event_counter",
                "drop table snapshots");
        }
    }

    static void executeSql(Connection con, String... statements) throws SQLException {
        for (String statement : statements) {
            try (CallableStatement cst = con.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    @Before
    public void setUp() {
        this.schema = new DefaultJdbcSchema("events", "streams", "event_counter", "snapshots");
        this.serialization = new JsonSerialization().register(JdbcTestEvent.class);
        this.eventStore = new JdbcEventStore(ds, schema, serialization);
    }

    protected String name() {
        return testName.getMethodName();
    }

    protected static List<EventData> events(int... amounts) {
        List<EventData> result = new ArrayList<>();
        for (int amount : amounts) {
            result.add(new EventData("JdbcTest", new JdbcTestEvent(amount, "note " + amount)));
        }
        return result;
    }

    protected void assertDb(long expected, String sql, Object... params) {
        assertEquals(expected, (long) template.queryForObject(sql, Long.class, params));
    }
}
