package com.sqlstage.service;

/**
 * Thrown when a cache entry exists but does not decode into a valid staged result.
 */
public class StagedResultCorruptException extends QueryServiceException {
    public StagedResultCorruptException(String message) {
        super(ErrorKind.RESULT_CORRUPT, message);
    }

    public StagedResultCorruptException(String message, Throwable cause) {
        super(ErrorKind.RESULT_CORRUPT, message, cause);
    }
}
