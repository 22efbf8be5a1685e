package com.sqlstage.controller;

import com.sqlstage.api.ExecuteRequest;
import com.sqlstage.api.ExecuteResponse;
import com.sqlstage.api.HealthResponse;
import com.sqlstage.api.MessageResponse;
import com.sqlstage.api.PageResponse;
import com.sqlstage.api.SchemaInfoResponse;
import com.sqlstage.api.TablesResponse;
import com.sqlstage.model.HealthStatus;
import com.sqlstage.service.DatabaseService;
import com.sqlstage.service.ResultNotFoundException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the query service. Failures are rendered by the global exception handler.
 */
@Slf4j
@RestController
@RequestMapping("/api/db")
public class DatabaseController {

    private final DatabaseService databaseService;

    public DatabaseController(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    /**
     * Probe the database, connecting first if needed.
     *
     * GET /api/db/test-connection
     *
     * @return 200 when connected, 503 with the failure message otherwise
     */
    @GetMapping("/test-connection")
    public ResponseEntity<HealthResponse> testConnection() {
        HealthStatus health = databaseService.healthCheck();
        log.info("Health check result: {}", health.getStatus());
        if (health.isConnected()) {
            return ResponseEntity.ok(new HealthResponse("connected", health.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("error", health.getMessage()));
    }

    @GetMapping("/tables")
    public TablesResponse getTables() {
        return databaseService.getTables();
    }

    @GetMapping("/schema-info")
    public SchemaInfoResponse getSchemaInfo() {
        return databaseService.getSchemaInfo();
    }

    /**
     * Execute a SQL statement verbatim.
     *
     * POST /api/db/execute
     *
     * @param request body with the SQL text in {@code query}
     * @return inline rows, or a staged-result id for results above the staging threshold
     */
    @PostMapping("/execute")
    public ExecuteResponse execute(@Valid @RequestBody ExecuteRequest request) {
        return databaseService.executeQuery(request.getQuery());
    }

    /**
     * Fetch one 100-row page of a staged result.
     *
     * GET /api/db/query-results/{queryId}/{page}
     */
    @GetMapping("/query-results/{queryId}/{page}")
    public PageResponse getQueryPage(@PathVariable("queryId") String queryId, @PathVariable("page") String page) {
        return databaseService.getQueryPage(queryId, page);
    }

    @DeleteMapping("/query-results/{queryId}")
    public ResponseEntity<Void> evictQueryResult(@PathVariable("queryId") String queryId) {
        if (!databaseService.evictQueryResult(queryId)) {
            throw new ResultNotFoundException(queryId);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/disconnect")
    public MessageResponse disconnect() {
        databaseService.disconnect();
        return new MessageResponse("Successfully disconnected from database");
    }
}
