package com.scorebot.data;

import com.scorebot.core.NanoClock;
import com.scorebot.core.Sleeper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling-window request budget: at most {@code maxRequests} grants in any {@code window}.
 * Callers over budget block until the oldest grant leaves the window.
 */
public final class RateLimiter {
    private final int maxRequests;
    private final long windowNanos;
    private final NanoClock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> grants = new ArrayDeque<>();
    private final AtomicLong totalGranted = new AtomicLong(0L);
    private final AtomicLong totalWaitNanos = new AtomicLong(0L);

    public RateLimiter(int maxRequests, long windowMs, NanoClock clock, Sleeper sleeper) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (windowMs <= 0L) {
            throw new IllegalArgumentException("windowMs must be > 0");
        }
        this.maxRequests = maxRequests;
        this.windowNanos = TimeUnit.MILLISECONDS.toNanos(windowMs);
        this.clock = clock == null ? NanoClock.SYSTEM : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    /**
     * Blocks until a request slot is available, then takes it.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                long now = clock.nanoTime();
                evictExpired(now);
                if (grants.size() < maxRequests) {
                    grants.addLast(now);
                    totalGranted.incrementAndGet();
                    return;
                }
                waitNanos = Math.max(1L, grants.peekFirst() + windowNanos - now);
            } finally {
                lock.unlock();
            }
            totalWaitNanos.addAndGet(waitNanos);
            sleeper.sleepNanos(waitNanos);
        }
    }

    public int inFlightWindowCount() {
        lock.lock();
        try {
            evictExpired(clock.nanoTime());
            return grants.size();
        } finally {
            lock.unlock();
        }
    }

    public long totalGranted() {
        return totalGranted.get();
    }

    public long totalWaitMillis() {
        return TimeUnit.NANOSECONDS.toMillis(totalWaitNanos.get());
    }

    private void evictExpired(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.removeFirst();
        }
    }
}
