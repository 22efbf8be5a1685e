package com.sqlstage.service;

import java.sql.SQLException;

/**
 * Thrown when the database rejects a statement. Carries the driver's diagnostics unmodified.
 */
public class ExecutionFailedException extends QueryServiceException {
    private final String sqlState;
    private final int vendorCode;

    /**
     * Wrap a driver error.
     *
     * @param cause SQL exception raised by the driver
     */
    public ExecutionFailedException(SQLException cause) {
        super(ErrorKind.EXECUTION_FAILED, cause.getMessage(), cause);
        this.sqlState = cause.getSQLState();
        this.vendorCode = cause.getErrorCode();
    }

    public String getSqlState() {
        return sqlState;
    }

    public int getVendorCode() {
        return vendorCode;
    }
}
