package com.sqlstage.service;

import java.time.Duration;

/**
 * Blocking pause used between connection attempts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
