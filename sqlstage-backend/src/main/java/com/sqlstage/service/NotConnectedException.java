package com.sqlstage.service;

/**
 * Thrown when an operation needs a live database handle and none is available.
 */
public class NotConnectedException extends QueryServiceException {
    public NotConnectedException(String message) {
        super(ErrorKind.NOT_CONNECTED, message);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(ErrorKind.NOT_CONNECTED, message, cause);
    }
}
