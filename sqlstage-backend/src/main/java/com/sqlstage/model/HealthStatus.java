package com.sqlstage.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of probing the live database connection.
 */
@Data
@AllArgsConstructor
public class HealthStatus {
    public enum Status {
        CONNECTED,
        ERROR
    }

    private Status status;
    private String message;

    public static HealthStatus connected() {
        return new HealthStatus(Status.CONNECTED, "Database is connected");
    }

    public static HealthStatus error(String message) {
        return new HealthStatus(Status.ERROR, message != null ? message : "Database connection failed");
    }

    public boolean isConnected() {
        return status == Status.CONNECTED;
    }
}
