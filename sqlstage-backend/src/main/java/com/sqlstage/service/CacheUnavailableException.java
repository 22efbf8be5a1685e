package com.sqlstage.service;

/**
 * Thrown when the result cache cannot be reached.
 */
public class CacheUnavailableException extends QueryServiceException {
    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CACHE_UNAVAILABLE, message, cause);
    }
}
