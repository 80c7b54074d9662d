package com.scorebot.runner;

import com.scorebot.model.FailureKind;
import com.scorebot.model.FetchState;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import com.scorebot.model.SymbolOutcome;

import java.util.List;

/**
 * Terminal result of driving one symbol through the fetch state machine.
 */
public final class FetchAttempt {
    public final Symbol symbol;
    public final FetchState state;
    public final RawMetricBag bag;
    public final int attempts;
    public final FailureKind failureKind;
    public final String errorCategory;
    public final String error;
    public final List<FetchState> path;
    private final boolean crashed;

    FetchAttempt(
            Symbol symbol,
            FetchState state,
            RawMetricBag bag,
            int attempts,
            FailureKind failureKind,
            String errorCategory,
            String error,
            List<FetchState> path
    ) {
        this(symbol, state, bag, attempts, failureKind, errorCategory, error, path, false);
    }

    private FetchAttempt(
            Symbol symbol,
            FetchState state,
            RawMetricBag bag,
            int attempts,
            FailureKind failureKind,
            String errorCategory,
            String error,
            List<FetchState> path,
            boolean crashed
    ) {
        this.crashed = crashed;
        this.symbol = symbol;
        this.state = state;
        this.bag = bag;
        this.attempts = attempts;
        this.failureKind = failureKind;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
        this.error = error == null ? "" : error;
        this.path = path == null ? List.of() : List.copyOf(path);
    }

    /**
     * A worker that died on an unexpected exception. Never retried.
     */
    static FetchAttempt crashed(Symbol symbol, Throwable error) {
        String message = error == null ? "unknown" : (error.getMessage() == null
                ? error.getClass().getSimpleName()
                : error.getMessage());
        return new FetchAttempt(
                symbol,
                FetchState.FAILED,
                null,
                0,
                FailureKind.PERMANENT,
                "worker_error",
                message,
                List.of(),
                true
        );
    }

    public boolean succeeded() {
        return state == FetchState.SUCCESS;
    }

    public int retries() {
        return Math.max(0, attempts - 1);
    }

    /**
     * A symbol the provider could not serve, permanently or after every retry, has no data.
     * Only a crashed worker counts as errored.
     */
    public SymbolOutcome outcome() {
        if (succeeded()) {
            return SymbolOutcome.SUCCEEDED;
        }
        return crashed ? SymbolOutcome.ERRORED : SymbolOutcome.NO_DATA;
    }

    /**
     * True when the symbol ran out of retries on transient errors. Drives the slowdown and the
     * deferred pass.
     */
    public boolean transientFailure() {
        return !succeeded() && !crashed && failureKind == FailureKind.TRANSIENT;
    }

    public String reason() {
        if (succeeded()) {
            return "";
        }
        return errorCategory.isEmpty() ? error : errorCategory + ": " + error;
    }
}
