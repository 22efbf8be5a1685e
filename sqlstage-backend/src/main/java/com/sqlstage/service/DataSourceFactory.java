package com.sqlstage.service;

import com.sqlstage.model.ConnectionConfig;

import javax.sql.DataSource;

/**
 * Opens the physical connection pool for a validated configuration.
 *
 * <p>Implementations may fail with any runtime exception; the connection manager treats every
 * failure as retryable.
 */
@FunctionalInterface
public interface DataSourceFactory {

    DataSource open(ConnectionConfig config);
}
