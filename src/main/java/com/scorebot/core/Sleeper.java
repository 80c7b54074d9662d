package com.scorebot.core;

import java.util.concurrent.TimeUnit;

/**
 * Blocking pause, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = nanos -> {
        if (nanos > 0L) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    };

    void sleepNanos(long nanos) throws InterruptedException;

    default void sleepMillis(long millis) throws InterruptedException {
        sleepNanos(TimeUnit.MILLISECONDS.toNanos(Math.max(0L, millis)));
    }
}
