package com.sqlstage.service;

/**
 * Machine-stable failure categories reported by the query service.
 *
 * <p>The name of each constant is what clients see in {@code ErrorResponse.code}.
 */
public enum ErrorKind {
    CONFIG_INVALID,
    CONNECTION_EXHAUSTED,
    NOT_CONNECTED,
    EXECUTION_FAILED,
    RESULT_NOT_FOUND,
    INVALID_PAGE_INDEX,
    RESULT_CORRUPT,
    CACHE_UNAVAILABLE
}
