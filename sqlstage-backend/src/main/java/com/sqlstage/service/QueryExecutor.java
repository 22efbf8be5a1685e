package com.sqlstage.service;

import com.sqlstage.api.ExecuteResponse;
import com.sqlstage.config.StagingProperties;
import com.sqlstage.model.FieldDescriptor;
import com.sqlstage.model.QueryResult;
import com.sqlstage.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs statements against the active connection and decides whether the result is returned inline
 * or staged in the result cache.
 *
 * <p>Statements run verbatim. Nothing here escapes or binds user input, so callers that build SQL
 * from untrusted text are exposed to SQL injection.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final StagedResultStore stagedResultStore;
    private final StagingProperties stagingProperties;

    public QueryExecutor(StagedResultStore stagedResultStore, StagingProperties stagingProperties) {
        this.stagedResultStore = stagedResultStore;
        this.stagingProperties = stagingProperties;
    }

    /**
     * Execute a complete SQL statement.
     *
     * @param dataSource active handle from the connection manager
     * @param sql statement text, executed as-is; for several statements the last result set is
     *            returned and update counts are summed
     * @return inline rows, or a staged-result handle when the row count exceeds the threshold
     * @throws ExecutionFailedException if the database rejects the statement
     */
    public ExecuteResponse execute(DataSource dataSource, String sql) {
        return execute(dataSource, sql, List.of());
    }

    /**
     * Execute a statement with positional parameters. Used for catalog queries whose arguments
     * come from earlier results.
     */
    public ExecuteResponse execute(DataSource dataSource, String sql, List<Object> params) {
        log.info("Executing query: {}", sql);
        QueryResult result;
        try {
            result = run(dataSource, sql, params);
        } catch (SQLException e) {
            log.error("Query failed: {} (SQLState: {}, Error Code: {})", e.getMessage(), e.getSQLState(), e.getErrorCode());
            throw new ExecutionFailedException(e);
        }
        return route(result);
    }

    ExecuteResponse route(QueryResult result) {
        int rowCount = result.rowCount();
        ExecuteResponse.Metadata metadata = new ExecuteResponse.Metadata(result.getRowsAffected(), result.getDurationMs());

        if (rowCount > stagingProperties.getLargeResultThreshold()) {
            String queryId = stagedResultStore.stage(result);
            return ExecuteResponse.builder()
                    .largeResult(true)
                    .queryId(queryId)
                    .rowCount(rowCount)
                    .fields(result.getFields())
                    .metadata(metadata)
                    .build();
        }

        return ExecuteResponse.builder()
                .largeResult(false)
                .rows(result.getRows())
                .fields(result.getFields())
                .rowCount(rowCount)
                .metadata(metadata)
                .build();
    }

    private QueryResult run(DataSource dataSource, String sql, List<Object> params) throws SQLException {
        long startTime = System.currentTimeMillis();

        try (Connection conn = dataSource.getConnection()) {
            // Plain Statement for parameter-less SQL: multi-statement text and driver-specific
            // commands are rejected by prepared statements.
            if (params == null || params.isEmpty()) {
                try (Statement stmt = conn.createStatement()) {
                    boolean isResultSet = stmt.execute(sql);
                    return collect(stmt, isResultSet, startTime);
                }
            }

            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                boolean isResultSet = stmt.execute();
                return collect(stmt, isResultSet, startTime);
            }
        }
    }

    /**
     * Walk every result the statement produced. Multi-statement text such as
     * {@code UPDATE ...; SELECT ...} returns the last result set, with the update counts of all
     * statements summed into {@code rowsAffected}.
     */
    private QueryResult collect(Statement stmt, boolean isResultSet, long startTime) throws SQLException {
        QueryResult last = null;
        long rowsAffected = 0;
        int resultSets = 0;

        while (true) {
            if (isResultSet) {
                try (ResultSet rs = stmt.getResultSet()) {
                    last = readRows(rs);
                }
                resultSets++;
            } else {
                int updateCount = stmt.getUpdateCount();
                if (updateCount == -1) {
                    break;
                }
                rowsAffected += updateCount;
            }
            isResultSet = stmt.getMoreResults();
        }

        if (resultSets > 1) {
            log.debug("Statement produced {} result sets, returning the last one", resultSets);
        }

        QueryResult.QueryResultBuilder result = QueryResult.builder()
                .rowsAffected(rowsAffected)
                .durationMs(System.currentTimeMillis() - startTime);
        if (last != null) {
            result.fields(last.getFields()).rows(last.getRows());
        }
        return result.build();
    }

    private QueryResult readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<FieldDescriptor> fields = new ArrayList<>(columnCount);
        String[] labels = new String[columnCount];
        String[] typeNames = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            labels[i - 1] = rsmd.getColumnLabel(i);
            typeNames[i - 1] = rsmd.getColumnTypeName(i);
            fields.add(new FieldDescriptor(labels[i - 1], typeNames[i - 1]));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels[i - 1], JdbcJsonSafe.read(rs, i, typeNames[i - 1]));
            }
            rows.add(row);
        }

        return QueryResult.builder()
                .fields(fields)
                .rows(rows)
                .build();
    }
}
