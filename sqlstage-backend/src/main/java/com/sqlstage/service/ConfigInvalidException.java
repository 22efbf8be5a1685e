package com.sqlstage.service;

/**
 * Thrown when a required connection setting is missing or out of range. Never retried.
 */
public class ConfigInvalidException extends QueryServiceException {
    public ConfigInvalidException(String message) {
        super(ErrorKind.CONFIG_INVALID, message);
    }
}
