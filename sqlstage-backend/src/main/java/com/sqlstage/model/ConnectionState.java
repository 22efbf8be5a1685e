package com.sqlstage.model;

/**
 * Lifecycle of the managed connection.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED
 *                 CONNECTING -> FAILED
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    FAILED
}
