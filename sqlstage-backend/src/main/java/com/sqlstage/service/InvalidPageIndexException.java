package com.sqlstage.service;

/**
 * Thrown for a negative or non-numeric page index.
 */
public class InvalidPageIndexException extends QueryServiceException {
    public InvalidPageIndexException(String rawValue) {
        super(ErrorKind.INVALID_PAGE_INDEX, "Page must be a non-negative integer, got: " + rawValue);
    }
}
