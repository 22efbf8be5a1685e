package com.sqlstage.service;

/**
 * Base type for every failure surfaced by the connection, execution and paging layers.
 */
public class QueryServiceException extends RuntimeException {
    private final ErrorKind kind;

    /**
     * Create a new exception.
     *
     * @param kind error kind
     * @param message error message
     */
    public QueryServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create a new exception with an underlying cause.
     *
     * @param kind error kind
     * @param message error message
     * @param cause underlying cause
     */
    public QueryServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
