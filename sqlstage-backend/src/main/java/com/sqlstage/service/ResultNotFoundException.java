package com.sqlstage.service;

/**
 * Thrown when a staged result id is unknown or its cache entry has expired.
 */
public class ResultNotFoundException extends QueryServiceException {
    private final String queryId;

    public ResultNotFoundException(String queryId) {
        super(ErrorKind.RESULT_NOT_FOUND, "Query results not found: " + queryId);
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }
}
