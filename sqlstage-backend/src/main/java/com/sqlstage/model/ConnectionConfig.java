package com.sqlstage.model;

import com.sqlstage.service.ConfigInvalidException;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * Settings for the single database connection pool owned by the connection manager.
 */
@Data
@Builder(toBuilder = true)
public class ConnectionConfig {
    private String host;
    private Integer port;
    private String database;
    private String user;

    @ToString.Exclude
    private String password;

    @Builder.Default
    private int poolMin = 2;

    @Builder.Default
    private int poolMax = 10;

    @Builder.Default
    private Duration connectionTimeout = Duration.ofSeconds(5);

    /**
     * Check that the fields needed to open a connection are present.
     *
     * @throws ConfigInvalidException on the first missing or invalid field
     */
    public void validate() {
        if (host == null || host.isBlank()) {
            throw new ConfigInvalidException("Missing required config field: host");
        }
        if (port == null || port <= 0) {
            throw new ConfigInvalidException("Missing required config field: port");
        }
        if (database == null || database.isBlank()) {
            throw new ConfigInvalidException("Missing required config field: database");
        }
        if (poolMax < 1 || poolMin < 0 || poolMin > poolMax) {
            throw new ConfigInvalidException("Invalid pool bounds: min=" + poolMin + ", max=" + poolMax);
        }
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }
}
