package com.sqlstage.service;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QueryIdGeneratorTest {

    @Test
    void next_usesClockMillis() {
        QueryIdGenerator generator = new QueryIdGenerator(() -> 1_700_000_000_000L);
        assertEquals("1700000000000", generator.next());
    }

    @Test
    void next_isStrictlyIncreasingWithinSameMillisecond() {
        QueryIdGenerator generator = new QueryIdGenerator(() -> 1000L);

        assertEquals("1000", generator.next());
        assertEquals("1001", generator.next());
        assertEquals("1002", generator.next());
    }

    @Test
    void next_followsClockWhenItMovesAhead() {
        AtomicLong clock = new AtomicLong(1000L);
        QueryIdGenerator generator = new QueryIdGenerator(clock::get);

        generator.next();
        generator.next();
        clock.set(5000L);

        assertEquals("5000", generator.next());
    }

    @Test
    void next_neverRepeatsAcrossThreads() throws Exception {
        QueryIdGenerator generator = new QueryIdGenerator(() -> 42L);
        Set<String> ids = java.util.Collections.synchronizedSet(new HashSet<>());

        Thread[] threads = new Thread[4];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    ids.add(generator.next());
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(2000, ids.size());
    }
}
