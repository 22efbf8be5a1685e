package com.sqlstage.service;

import com.sqlstage.api.ExecuteResponse;
import com.sqlstage.api.PageResponse;
import com.sqlstage.api.SchemaInfoResponse;
import com.sqlstage.api.TablesResponse;
import com.sqlstage.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.net.ConnectException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DatabaseServiceTest {

    private ConnectionManager connectionManager;
    private QueryExecutor queryExecutor;
    private ResultPager resultPager;
    private StagedResultStore stagedResultStore;
    private DataSource dataSource;
    private DatabaseService service;

    @BeforeEach
    void setUp() {
        connectionManager = mock(ConnectionManager.class);
        queryExecutor = mock(QueryExecutor.class);
        resultPager = mock(ResultPager.class);
        stagedResultStore = mock(StagedResultStore.class);
        dataSource = mock(DataSource.class);
        service = new DatabaseService(connectionManager, queryExecutor, resultPager, stagedResultStore);
    }

    private void connected() {
        when(connectionManager.isConnected()).thenReturn(true);
        when(connectionManager.getActiveHandle()).thenReturn(dataSource);
    }

    private static ExecuteResponse inline(List<Map<String, Object>> rows) {
        return ExecuteResponse.builder().rows(rows).rowCount(rows.size()).build();
    }

    @Test
    void executeQuery_blankIsRejectedWithoutConnecting() {
        assertThrows(IllegalArgumentException.class, () -> service.executeQuery("  "));
        assertThrows(IllegalArgumentException.class, () -> service.executeQuery(null));
        verifyNoInteractions(connectionManager, queryExecutor);
    }

    @Test
    void executeQuery_connectsLazily() {
        when(connectionManager.isConnected()).thenReturn(false);
        when(connectionManager.getActiveHandle()).thenReturn(dataSource);
        ExecuteResponse expected = inline(List.of(Map.of("n", 1)));
        when(queryExecutor.execute(dataSource, "SELECT 1 AS n")).thenReturn(expected);

        assertSame(expected, service.executeQuery("SELECT 1 AS n"));
        verify(connectionManager).connect();
    }

    @Test
    void executeQuery_reusesLiveConnection() {
        connected();
        when(queryExecutor.execute(dataSource, "SELECT 1")).thenReturn(inline(List.of()));

        service.executeQuery("SELECT 1");

        verify(connectionManager, never()).connect();
    }

    @Test
    void executeQuery_exhaustedRetriesSurfaceAsNotConnected() {
        when(connectionManager.isConnected()).thenReturn(false);
        ConnectionExhaustedException exhausted = new ConnectionExhaustedException(3, new ConnectException("refused"));
        doThrow(exhausted).when(connectionManager).connect();

        NotConnectedException ex = assertThrows(NotConnectedException.class, () -> service.executeQuery("SELECT 1"));

        assertSame(exhausted, ex.getCause());
        assertTrue(ex.getMessage().contains("after 3 attempts"));
        verifyNoInteractions(queryExecutor);
    }

    @Test
    void executeQuery_invalidConfigPropagates() {
        when(connectionManager.isConnected()).thenReturn(false);
        doThrow(new ConfigInvalidException("Missing required config field: host")).when(connectionManager).connect();

        assertThrows(ConfigInvalidException.class, () -> service.executeQuery("SELECT 1"));
    }

    @Test
    void getTables_inline() {
        connected();
        when(queryExecutor.execute(dataSource, DatabaseService.TABLES_SQL))
                .thenReturn(inline(List.of(Map.of("table_name", "orders"), Map.of("TABLE_NAME", "users"))));

        TablesResponse response = service.getTables();

        assertEquals(List.of("orders", "users"), response.getTables());
        assertEquals(2, response.getTableCount());
        assertFalse(response.isLargeResult());
    }

    @Test
    void getTables_stagedListingReportsQueryId() {
        connected();
        when(queryExecutor.execute(dataSource, DatabaseService.TABLES_SQL))
                .thenReturn(ExecuteResponse.builder().largeResult(true).queryId("42").rowCount(1200).build());

        TablesResponse response = service.getTables();

        assertTrue(response.isLargeResult());
        assertEquals("42", response.getQueryId());
        assertEquals(1200, response.getTableCount());
        assertNull(response.getTables());
    }

    @Test
    void getSchemaInfo_countsAndListsTablesPerSchema() {
        connected();
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMAS_SQL))
                .thenReturn(inline(List.of(Map.of("schema_name", "public"), Map.of("schema_name", "sales"))));
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMA_TABLE_COUNT_SQL, List.of("public")))
                .thenReturn(inline(List.of(Map.of("table_count", 2L))));
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMA_TABLES_SQL, List.of("public")))
                .thenReturn(inline(List.of(Map.of("table_name", "a"), Map.of("table_name", "b"))));
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMA_TABLE_COUNT_SQL, List.of("sales")))
                .thenReturn(inline(List.of(Map.of("TABLE_COUNT", 1500L))));
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMA_TABLES_SQL, List.of("sales")))
                .thenReturn(ExecuteResponse.builder().largeResult(true).queryId("77").rowCount(1500).build());

        SchemaInfoResponse response = service.getSchemaInfo();

        assertEquals(2, response.getSchemaCount());
        assertEquals(List.of("public", "sales"), response.getSchemas());
        assertEquals(List.of("public", "sales"), List.copyOf(response.getDetails().keySet()));

        SchemaInfoResponse.SchemaDetail publicSchema = response.getDetails().get("public");
        assertEquals(2, publicSchema.getTableCount());
        assertEquals(List.of("a", "b"), publicSchema.getTables());
        assertNull(publicSchema.getTablesQueryId());

        SchemaInfoResponse.SchemaDetail sales = response.getDetails().get("sales");
        assertEquals(1500, sales.getTableCount());
        assertTrue(sales.getTables().isEmpty());
        assertEquals("77", sales.getTablesQueryId());
    }

    @Test
    void getSchemaInfo_noUserSchemas() {
        connected();
        when(queryExecutor.execute(dataSource, DatabaseService.SCHEMAS_SQL)).thenReturn(inline(List.of()));

        SchemaInfoResponse response = service.getSchemaInfo();

        assertEquals(0, response.getSchemaCount());
        assertTrue(response.getDetails().isEmpty());
        verify(queryExecutor, never()).execute(any(), anyString(), any());
    }

    @Test
    void getQueryPage_neverTouchesTheDatabase() {
        PageResponse page = PageResponse.builder().results(List.of()).build();
        when(resultPager.getPage("123", 3)).thenReturn(page);

        assertSame(page, service.getQueryPage("123", "3"));
        verifyNoInteractions(connectionManager, queryExecutor);
    }

    @Test
    void getQueryPage_largeDigitOnlyIndexIsAccepted() {
        PageResponse page = PageResponse.builder().results(List.of()).build();
        when(resultPager.getPage("123", 3_000_000_000L)).thenReturn(page);

        assertSame(page, service.getQueryPage("123", "3000000000"));
    }

    @Test
    void getQueryPage_invalidIndexIsRejected() {
        assertThrows(InvalidPageIndexException.class, () -> service.getQueryPage("123", "x"));
        verifyNoInteractions(resultPager);
    }

    @Test
    void evictQueryResult_delegatesToStore() {
        when(stagedResultStore.evict("123")).thenReturn(true);

        assertTrue(service.evictQueryResult("123"));
        assertFalse(service.evictQueryResult("456"));
        verifyNoInteractions(connectionManager);
    }

    @Test
    void healthCheckAndDisconnectDelegate() {
        when(connectionManager.healthCheck()).thenReturn(HealthStatus.connected());

        assertTrue(service.healthCheck().isConnected());
        service.disconnect();

        verify(connectionManager).disconnect();
    }
}
