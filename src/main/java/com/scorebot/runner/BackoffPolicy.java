package com.scorebot.runner;

import com.scorebot.config.PipelineSettings;

import java.util.Random;

/**
 * Capped exponential backoff with additive jitter.
 */
public final class BackoffPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final Random random;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, double jitterRatio, Random random) {
        if (baseDelayMs < 0L || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("backoff requires 0 <= base <= max");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = Math.max(0.0, Math.min(1.0, jitterRatio));
        this.random = random == null ? new Random() : random;
    }

    public static BackoffPolicy from(PipelineSettings settings, Random random) {
        return new BackoffPolicy(
                settings.retryBaseDelayMs,
                settings.retryMaxDelayMs,
                settings.retryJitterRatio,
                random
        );
    }

    /**
     * Delay before the given retry (1-based): {@code min(max, base * 2^(retry-1))} without jitter.
     */
    public long baseDelayMs(int retry) {
        if (retry < 1 || baseDelayMs == 0L) {
            return 0L;
        }
        int shift = Math.min(retry - 1, 62);
        long scaled = baseDelayMs << shift;
        if (scaled < 0L || (scaled >> shift) != baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, scaled);
    }

    /**
     * Delay including jitter drawn uniformly from {@code [0, jitterRatio * delay]}.
     */
    public long delayMs(int retry) {
        long delay = baseDelayMs(retry);
        if (delay <= 0L || jitterRatio <= 0.0) {
            return delay;
        }
        double jitter;
        synchronized (random) {
            jitter = random.nextDouble() * jitterRatio * delay;
        }
        return delay + Math.round(jitter);
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
