package com.sqlstage.service;

import com.sqlstage.api.ExecuteResponse;
import com.sqlstage.api.PageResponse;
import com.sqlstage.api.SchemaInfoResponse;
import com.sqlstage.api.TablesResponse;
import com.sqlstage.model.HealthStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for the REST layer: composes the connection manager, query executor and result
 * pager.
 *
 * <p>Database-backed operations connect lazily through {@link #ensureConnected()}. Paging and
 * eviction only touch the result cache and keep working while the database is unreachable.
 */
@Slf4j
@Service
public class DatabaseService {

    static final String TABLES_SQL =
            "SELECT table_name FROM information_schema.tables WHERE table_schema = 'public'";

    static final String SCHEMAS_SQL =
            "SELECT DISTINCT schema_name FROM information_schema.schemata "
                    + "WHERE schema_name NOT IN ('information_schema', 'pg_catalog', 'pg_toast') "
                    + "ORDER BY schema_name";

    static final String SCHEMA_TABLE_COUNT_SQL =
            "SELECT COUNT(*) AS table_count FROM information_schema.tables WHERE table_schema = ?";

    static final String SCHEMA_TABLES_SQL =
            "SELECT table_name FROM information_schema.tables WHERE table_schema = ? ORDER BY table_name";

    private final ConnectionManager connectionManager;
    private final QueryExecutor queryExecutor;
    private final ResultPager resultPager;
    private final StagedResultStore stagedResultStore;

    public DatabaseService(ConnectionManager connectionManager,
                           QueryExecutor queryExecutor,
                           ResultPager resultPager,
                           StagedResultStore stagedResultStore) {
        this.connectionManager = Objects.requireNonNull(connectionManager);
        this.queryExecutor = Objects.requireNonNull(queryExecutor);
        this.resultPager = Objects.requireNonNull(resultPager);
        this.stagedResultStore = Objects.requireNonNull(stagedResultStore);
    }

    public TablesResponse getTables() {
        DataSource ds = ensureConnected();
        ExecuteResponse result = queryExecutor.execute(ds, TABLES_SQL);
        if (result.isLargeResult()) {
            return TablesResponse.builder()
                    .largeResult(true)
                    .queryId(result.getQueryId())
                    .tableCount(result.getRowCount())
                    .build();
        }
        List<String> tables = column(result, "table_name");
        log.debug("Tables fetched: {}", tables);
        return TablesResponse.builder()
                .tables(tables)
                .tableCount(tables.size())
                .build();
    }

    /**
     * Count and list the tables of every user schema. Two sequential round trips per schema.
     */
    public SchemaInfoResponse getSchemaInfo() {
        DataSource ds = ensureConnected();
        List<String> schemas = column(queryExecutor.execute(ds, SCHEMAS_SQL), "schema_name");

        Map<String, SchemaInfoResponse.SchemaDetail> details = new LinkedHashMap<>();
        for (String schema : schemas) {
            ExecuteResponse countResult = queryExecutor.execute(ds, SCHEMA_TABLE_COUNT_SQL, List.of(schema));
            long tableCount = firstNumber(countResult, "table_count");

            ExecuteResponse tablesResult = queryExecutor.execute(ds, SCHEMA_TABLES_SQL, List.of(schema));
            SchemaInfoResponse.SchemaDetail.SchemaDetailBuilder detail = SchemaInfoResponse.SchemaDetail.builder()
                    .tableCount(tableCount);
            if (tablesResult.isLargeResult()) {
                detail.tables(List.of()).tablesQueryId(tablesResult.getQueryId());
            } else {
                detail.tables(column(tablesResult, "table_name"));
            }
            details.put(schema, detail.build());
        }

        return SchemaInfoResponse.builder()
                .schemaCount(schemas.size())
                .schemas(schemas)
                .details(details)
                .build();
    }

    /**
     * @throws IllegalArgumentException if {@code sql} is blank
     */
    public ExecuteResponse executeQuery(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        DataSource ds = ensureConnected();
        return queryExecutor.execute(ds, sql);
    }

    public PageResponse getQueryPage(String queryId, String page) {
        return getQueryPage(queryId, ResultPager.parsePageIndex(page));
    }

    public PageResponse getQueryPage(String queryId, long page) {
        return resultPager.getPage(queryId, page);
    }

    public boolean evictQueryResult(String queryId) {
        return stagedResultStore.evict(queryId);
    }

    public HealthStatus healthCheck() {
        return connectionManager.healthCheck();
    }

    @PreDestroy
    public void disconnect() {
        connectionManager.disconnect();
    }

    private DataSource ensureConnected() {
        if (!connectionManager.isConnected()) {
            try {
                connectionManager.connect();
            } catch (ConnectionExhaustedException e) {
                throw new NotConnectedException("Database not connected: " + e.getMessage(), e);
            }
        }
        return connectionManager.getActiveHandle();
    }

    private static List<String> column(ExecuteResponse result, String name) {
        List<Map<String, Object>> rows = result.getRows() != null ? result.getRows() : List.of();
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = valueIgnoreCase(row, name);
            if (value != null) {
                values.add(value.toString());
            }
        }
        return values;
    }

    private static long firstNumber(ExecuteResponse result, String name) {
        if (result.getRows() == null || result.getRows().isEmpty()) {
            return 0L;
        }
        Object value = valueIgnoreCase(result.getRows().get(0), name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        return value != null ? Long.parseLong(value.toString()) : 0L;
    }

    // Catalog column labels are lower case on Postgres but upper case on some other engines
    private static Object valueIgnoreCase(Map<String, Object> row, String name) {
        Object value = row.get(name);
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
