package com.sqlstage.config;

import com.sqlstage.model.ConnectionConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the backing Postgres database.
 */
@Data
@ConfigurationProperties(prefix = "sqlstage.database")
public class DatabaseProperties {

    private String host;
    private Integer port;

    /** Database name. */
    private String name;

    private String user;
    private String password;

    private Pool pool = new Pool();
    private Retry retry = new Retry();

    /** How long Hikari waits for a physical connection before giving up on an attempt. */
    private Duration connectionTimeout = Duration.ofSeconds(5);

    @Data
    public static class Pool {
        private int min = 2;
        private int max = 10;
    }

    @Data
    public static class Retry {
        /** Total connection attempts per connect() call. */
        private int attempts = 3;

        /** Fixed pause between attempts. */
        private Duration delay = Duration.ofSeconds(5);
    }

    public ConnectionConfig toConnectionConfig() {
        return ConnectionConfig.builder()
                .host(host)
                .port(port)
                .database(name)
                .user(user)
                .password(password)
                .poolMin(pool.getMin())
                .poolMax(pool.getMax())
                .connectionTimeout(connectionTimeout)
                .build();
    }
}
