package com.sqlstage.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Generates identifiers for staged results from the wall clock in milliseconds.
 *
 * <p>Identifiers are strictly increasing within the process: two executions staged in the same
 * millisecond get consecutive values instead of colliding on one cache key.
 */
@Component
public class QueryIdGenerator {

    private final LongSupplier clock;
    private final AtomicLong last = new AtomicLong();

    public QueryIdGenerator() {
        this(System::currentTimeMillis);
    }

    QueryIdGenerator(LongSupplier clock) {
        this.clock = clock;
    }

    public String next() {
        long now = clock.getAsLong();
        long id = last.accumulateAndGet(now, (prev, current) -> Math.max(prev + 1, current));
        return Long.toString(id);
    }
}
