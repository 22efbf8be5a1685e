package com.sqlstage.service;

import com.sqlstage.model.ConnectionConfig;
import com.sqlstage.model.ConnectionState;
import com.sqlstage.model.HealthStatus;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the lifecycle of the single database connection pool used by the service.
 *
 * <p>Connection attempts are single-flight: {@link #connect()} serializes callers on a lock that
 * nothing else takes, so a caller waiting out the retry delay never blocks disconnects, handle
 * lookups or cache-only operations.
 */
@Slf4j
public class ConnectionManager {

    static final String LIVENESS_PROBE = "SELECT 1";

    private final ConnectionConfig config;
    private final DataSourceFactory dataSourceFactory;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final AtomicReference<DataSource> handle = new AtomicReference<>();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * Create a connection manager.
     *
     * @param config connection settings, validated on every connect
     * @param dataSourceFactory opens the underlying pool
     * @param retryPolicy attempt budget and delay
     * @param sleeper pause between attempts
     */
    public ConnectionManager(ConnectionConfig config,
                             DataSourceFactory dataSourceFactory,
                             RetryPolicy retryPolicy,
                             Sleeper sleeper) {
        this.config = Objects.requireNonNull(config);
        this.dataSourceFactory = Objects.requireNonNull(dataSourceFactory);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Open the pool and confirm it with a liveness probe, retrying with a fixed delay.
     *
     * @throws ConfigInvalidException if host, port or database is missing (no attempt is made)
     * @throws ConnectionExhaustedException if every attempt failed
     * @throws NotConnectedException if interrupted while waiting between attempts
     */
    public void connect() {
        connectLock.lock();
        try {
            if (isConnected()) {
                return;
            }

            config.validate();

            log.info("Attempting to connect to database: host={}, port={}, database={}, user={}, pool={}..{}",
                    config.getHost(), config.getPort(), config.getDatabase(), config.getUser(),
                    config.getPoolMin(), config.getPoolMax());

            state = ConnectionState.CONNECTING;
            int maxAttempts = retryPolicy.maxAttempts();
            Exception lastError = null;

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    DataSource ds = openAndProbe();
                    handle.set(ds);
                    state = ConnectionState.CONNECTED;
                    log.info("Database connected successfully on attempt {}/{}", attempt, maxAttempts);
                    return;
                } catch (Exception e) {
                    lastError = e;
                    logAttemptFailure(e, attempt, maxAttempts);
                }

                if (attempt < maxAttempts) {
                    log.info("Retrying connection in {}s... (attempts left: {})",
                            retryPolicy.delay().toSeconds(), maxAttempts - attempt);
                    try {
                        sleeper.sleep(retryPolicy.delay());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        state = ConnectionState.DISCONNECTED;
                        throw new NotConnectedException("Interrupted while waiting to reconnect", e);
                    }
                }
            }

            state = ConnectionState.FAILED;
            throw new ConnectionExhaustedException(maxAttempts, lastError);
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Release the pool if one is open. Calling this when already disconnected is a no-op.
     */
    public void disconnect() {
        DataSource ds = handle.getAndSet(null);
        state = ConnectionState.DISCONNECTED;
        if (ds != null) {
            close(ds);
            log.info("Database disconnected successfully");
        }
    }

    /**
     * Probe the live connection, connecting first if needed.
     *
     * <p>Any failure releases the handle so the next operation reconnects instead of reusing a
     * stale pool.
     *
     * @return connected, or error with the failure message
     */
    public HealthStatus healthCheck() {
        try {
            if (!isConnected()) {
                connect();
            }
            probe(getActiveHandle());
            return HealthStatus.connected();
        } catch (QueryServiceException | SQLException e) {
            log.warn("Health check failed: {}", e.getMessage());
            disconnect();
            return HealthStatus.error(e.getMessage());
        }
    }

    /**
     * @return the live data source
     * @throws NotConnectedException unless the state is {@link ConnectionState#CONNECTED}
     */
    public DataSource getActiveHandle() {
        DataSource ds = handle.get();
        if (state != ConnectionState.CONNECTED || ds == null) {
            throw new NotConnectedException("Database not connected");
        }
        return ds;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && handle.get() != null;
    }

    ConnectionState getState() {
        return state;
    }

    private DataSource openAndProbe() throws SQLException {
        DataSource ds = dataSourceFactory.open(config);
        try {
            probe(ds);
            return ds;
        } catch (SQLException | RuntimeException e) {
            close(ds);
            throw e;
        }
    }

    private void probe(DataSource ds) throws SQLException {
        try (Connection conn = ds.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(LIVENESS_PROBE);
        }
    }

    private void close(DataSource ds) {
        if (ds instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close database pool: {}", e.getMessage(), e);
            }
        }
    }

    private void logAttemptFailure(Exception e, int attempt, int maxAttempts) {
        if (e instanceof SQLException sqlException) {
            log.error("Database connection error on attempt {}/{}: {} (SQLState: {}, Error Code: {}, host={}, port={}, database={}, user={})",
                    attempt, maxAttempts, e.getMessage(), sqlException.getSQLState(), sqlException.getErrorCode(),
                    config.getHost(), config.getPort(), config.getDatabase(), config.getUser());
        } else {
            log.error("Database connection error on attempt {}/{}: {} (host={}, port={}, database={}, user={})",
                    attempt, maxAttempts, e.getMessage(),
                    config.getHost(), config.getPort(), config.getDatabase(), config.getUser());
        }
    }
}
