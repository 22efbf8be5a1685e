package com.sqlstage.service;

import java.time.Duration;

/**
 * Fixed-count, fixed-delay retry budget for opening the database connection.
 *
 * @param maxAttempts total attempts, including the first
 * @param delay pause between two attempts
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be a non-negative duration");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(5));
    }
}
