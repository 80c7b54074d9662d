package com.scorebot.core;

/**
 * Monotonic time source, swappable in tests.
 */
@FunctionalInterface
public interface NanoClock {
    NanoClock SYSTEM = System::nanoTime;

    long nanoTime();
}
