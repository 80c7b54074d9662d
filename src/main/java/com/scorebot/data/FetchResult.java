package com.scorebot.data;

import com.scorebot.model.FailureKind;
import com.scorebot.model.RawMetricBag;

/**
 * Outcome of a single provider attempt.
 */
public final class FetchResult {
    public final RawMetricBag bag;
    public final boolean success;
    public final FailureKind failureKind;
    public final String errorCategory;
    public final String error;
    public final long latencyNanos;

    private FetchResult(
            RawMetricBag bag,
            boolean success,
            FailureKind failureKind,
            String errorCategory,
            String error,
            long latencyNanos
    ) {
        this.bag = bag;
        this.success = success;
        this.failureKind = failureKind;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
        this.error = error == null ? "" : error;
        this.latencyNanos = Math.max(0L, latencyNanos);
    }

    public static FetchResult success(RawMetricBag bag, long latencyNanos) {
        return new FetchResult(bag, true, null, "", "", latencyNanos);
    }

    public static FetchResult failed(FailureKind kind, String category, String error, long latencyNanos) {
        return new FetchResult(null, false, kind == null ? FailureKind.PERMANENT : kind, category, error, latencyNanos);
    }

    public boolean retryable() {
        return !success && failureKind != null && failureKind.retryable();
    }
}
