package com.sqlstage.service;

/**
 * Thrown when every connection attempt in the retry budget has failed.
 */
public class ConnectionExhaustedException extends QueryServiceException {
    private final int attempts;

    /**
     * Create a new exception.
     *
     * @param attempts number of attempts made
     * @param lastError error from the final attempt
     */
    public ConnectionExhaustedException(int attempts, Throwable lastError) {
        super(ErrorKind.CONNECTION_EXHAUSTED,
                "Failed to connect to database after " + attempts + " attempts"
                        + (lastError != null && lastError.getMessage() != null ? ": " + lastError.getMessage() : ""),
                lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
