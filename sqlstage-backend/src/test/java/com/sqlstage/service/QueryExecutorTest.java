package com.sqlstage.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqlstage.api.ExecuteResponse;
import com.sqlstage.cache.InMemoryResultCache;
import com.sqlstage.config.StagingProperties;
import com.sqlstage.model.StagedResultSet;
import com.sqlstage.model.FieldDescriptor;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryExecutorTest {

    private JdbcDataSource dataSource;
    private InMemoryResultCache cache;
    private StagedResultStore store;
    private StagingProperties stagingProperties;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:exec-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE events (id INT PRIMARY KEY, name VARCHAR(64))");
            stmt.execute("INSERT INTO events SELECT X, 'event-' || X FROM SYSTEM_RANGE(1, 1500)");
        }

        cache = new InMemoryResultCache();
        store = new StagedResultStore(cache, new StagedResultCodec(new ObjectMapper()), new QueryIdGenerator());
        stagingProperties = new StagingProperties();
        executor = new QueryExecutor(store, stagingProperties);
    }

    @Test
    void execute_smallResultIsInline() {
        ExecuteResponse response = executor.execute(dataSource, "SELECT id, name FROM events WHERE id <= 5 ORDER BY id");

        assertFalse(response.isLargeResult());
        assertNull(response.getQueryId());
        assertEquals(5, response.getRowCount());
        assertEquals(5, response.getRows().size());
        assertEquals(List.of("ID", "NAME"), List.copyOf(response.getRows().get(0).keySet()));
        assertEquals("event-1", response.getRows().get(0).get("NAME"));
        assertEquals("ID", response.getFields().get(0).getName());
        assertEquals(0, cache.size());
    }

    @Test
    void execute_exactlyThresholdRowsStaysInline() {
        ExecuteResponse response = executor.execute(dataSource, "SELECT id FROM events WHERE id <= 1000");

        assertFalse(response.isLargeResult());
        assertEquals(1000, response.getRows().size());
        assertEquals(0, cache.size());
    }

    @Test
    void execute_largeResultIsStaged() {
        ExecuteResponse response = executor.execute(dataSource, "SELECT id, name FROM events ORDER BY id");

        assertTrue(response.isLargeResult());
        assertNotNull(response.getQueryId());
        assertEquals(1500, response.getRowCount());
        assertNull(response.getRows());
        assertEquals(2, response.getFields().size());

        String key = StagedResultStore.key(response.getQueryId());
        assertEquals(Duration.ofSeconds(3600), cache.ttlOf(key));

        StagedResultSet staged = store.load(response.getQueryId());
        assertEquals(1500, staged.getRows().size());
        assertEquals(1, staged.getRows().get(0).get("ID"));
        assertEquals("event-1500", staged.getRows().get(1499).get("NAME"));
    }

    @Test
    void execute_eachLargeResultGetsItsOwnId() {
        ExecuteResponse first = executor.execute(dataSource, "SELECT id FROM events");
        ExecuteResponse second = executor.execute(dataSource, "SELECT id FROM events");

        assertNotEquals(first.getQueryId(), second.getQueryId());
        assertEquals(2, cache.size());
    }

    @Test
    void execute_thresholdIsConfigurable() {
        stagingProperties.setLargeResultThreshold(10);

        ExecuteResponse response = executor.execute(dataSource, "SELECT id FROM events WHERE id <= 11");

        assertTrue(response.isLargeResult());
        assertEquals(11, response.getRowCount());
    }

    @Test
    void execute_invalidSqlCarriesDriverDiagnostics() {
        ExecutionFailedException ex = assertThrows(ExecutionFailedException.class,
                () -> executor.execute(dataSource, "SELEC * FROM events"));

        assertEquals(ErrorKind.EXECUTION_FAILED, ex.getKind());
        assertNotNull(ex.getSqlState());
        assertTrue(ex.getSqlState().startsWith("42"));
        assertNotEquals(0, ex.getVendorCode());
        assertEquals(0, cache.size());
    }

    @Test
    void execute_missingTableFails() {
        assertThrows(ExecutionFailedException.class,
                () -> executor.execute(dataSource, "SELECT * FROM no_such_table"));
    }

    @Test
    void execute_updateReportsRowsAffected() {
        ExecuteResponse response = executor.execute(dataSource, "UPDATE events SET name = 'x' WHERE id <= 10");

        assertFalse(response.isLargeResult());
        assertEquals(0, response.getRowCount());
        assertEquals(10, response.getMetadata().getRowsAffected());
        assertTrue(response.getRows().isEmpty());
    }

    @Test
    void execute_bindsPositionalParameters() {
        ExecuteResponse response = executor.execute(dataSource,
                "SELECT name FROM events WHERE id = ?", List.of(7));

        assertEquals(1, response.getRowCount());
        assertEquals("event-7", response.getRows().get(0).get("NAME"));
    }

    @Test
    void execute_emptyResultKeepsFields() {
        ExecuteResponse response = executor.execute(dataSource, "SELECT id, name FROM events WHERE id < 0");

        assertFalse(response.isLargeResult());
        assertEquals(0, response.getRowCount());
        assertEquals(2, response.getFields().size());
    }

    @Test
    void execute_zonedTimestampKeepsOffset() throws Exception {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE audit (id INT, created_at TIMESTAMP WITH TIME ZONE)");
            stmt.execute("INSERT INTO audit VALUES (1, TIMESTAMP WITH TIME ZONE '2024-03-01 12:30:00+02:00')");
        }

        ExecuteResponse response = executor.execute(dataSource, "SELECT created_at FROM audit");

        assertEquals("2024-03-01T12:30+02:00", response.getRows().get(0).get("CREATED_AT"));
    }

    @Test
    void execute_multiStatementReturnsLastResultAndSumsUpdates() throws Exception {
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("total");
        when(metaData.getColumnTypeName(1)).thenReturn("int8");
        ResultSet rs = mock(ResultSet.class);
        when(rs.getMetaData()).thenReturn(metaData);
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(1490L);

        String sql = "DELETE FROM events WHERE id <= 4; DELETE FROM events WHERE id <= 10; SELECT COUNT(*) AS total FROM events";
        Statement stmt = mock(Statement.class);
        when(stmt.execute(sql)).thenReturn(false);
        when(stmt.getUpdateCount()).thenReturn(4, 6, -1);
        when(stmt.getMoreResults()).thenReturn(false, true, false);
        when(stmt.getResultSet()).thenReturn(rs);
        Connection conn = mock(Connection.class);
        when(conn.createStatement()).thenReturn(stmt);
        javax.sql.DataSource mocked = mock(javax.sql.DataSource.class);
        when(mocked.getConnection()).thenReturn(conn);

        ExecuteResponse response = executor.execute(mocked, sql);

        assertEquals(1, response.getRowCount());
        assertEquals(1490L, response.getRows().get(0).get("total"));
        assertEquals(List.of(new FieldDescriptor("total", "int8")), response.getFields());
        assertEquals(10, response.getMetadata().getRowsAffected());
    }
}
