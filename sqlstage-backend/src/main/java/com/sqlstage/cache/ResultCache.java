package com.sqlstage.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry time-to-live used to hold staged query results.
 */
public interface ResultCache {

    /**
     * Store a value only if the key is not present.
     *
     * @return true if the value was written, false if the key was already taken
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);
}
