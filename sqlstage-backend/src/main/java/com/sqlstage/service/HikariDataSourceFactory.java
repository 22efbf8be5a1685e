package com.sqlstage.service;

import com.sqlstage.model.ConnectionConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

/**
 * Builds the HikariCP pool for the configured Postgres database.
 *
 * <p>Hikari opens its first connection eagerly, so an unreachable server fails here and counts as
 * one connection attempt.
 */
public class HikariDataSourceFactory implements DataSourceFactory {

    static final String POOL_NAME = "sqlstage-pool";

    @Override
    public DataSource open(ConnectionConfig config) {
        return new HikariDataSource(buildHikariConfig(config));
    }

    HikariConfig buildHikariConfig(ConnectionConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setJdbcUrl(config.jdbcUrl());
        hikari.setUsername(config.getUser());
        hikari.setPassword(config.getPassword());
        // Shows up as pg_stat_activity.application_name
        hikari.addDataSourceProperty("ApplicationName", "sqlstage");

        hikari.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        hikari.setMaximumPoolSize(config.getPoolMax());
        hikari.setMinimumIdle(config.getPoolMin());
        hikari.setPoolName(POOL_NAME);
        return hikari;
    }
}
