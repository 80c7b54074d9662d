package com.scorebot.runner;

import com.scorebot.core.Sleeper;
import com.scorebot.data.FetchResult;
import com.scorebot.data.RateLimitedFetchClient;
import com.scorebot.model.FailureKind;
import com.scorebot.model.FetchState;
import com.scorebot.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one symbol through PENDING, FETCHING, BACKOFF until SUCCESS or FAILED.
 * Transient failures are retried up to {@code maxRetries} times; permanent ones are not.
 */
public final class SymbolFetcher {
    private static final Logger LOG = LogManager.getLogger(SymbolFetcher.class);

    private final RateLimitedFetchClient client;
    private final BackoffPolicy backoff;
    private final int maxRetries;
    private final Sleeper sleeper;

    public SymbolFetcher(RateLimitedFetchClient client, BackoffPolicy backoff, int maxRetries, Sleeper sleeper) {
        this.client = client;
        this.backoff = backoff;
        this.maxRetries = Math.max(0, maxRetries);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public FetchAttempt fetch(Symbol symbol) throws InterruptedException {
        Machine machine = new Machine();
        int attempts = 0;
        FetchResult last = null;
        while (!machine.state.terminal()) {
            switch (machine.state) {
                case PENDING:
                    machine.moveTo(FetchState.FETCHING);
                    break;
                case FETCHING:
                    attempts++;
                    last = client.fetch(symbol);
                    if (last.success) {
                        machine.moveTo(FetchState.SUCCESS);
                    } else if (last.retryable() && attempts <= maxRetries) {
                        machine.moveTo(FetchState.BACKOFF);
                    } else {
                        machine.moveTo(FetchState.FAILED);
                    }
                    break;
                case BACKOFF:
                    long delayMs = backoff.delayMs(attempts);
                    LOG.debug("Retrying {} in {}ms after {} (retry {}/{})",
                            symbol.ticker(), delayMs, last.errorCategory, attempts, maxRetries);
                    sleeper.sleepMillis(delayMs);
                    machine.moveTo(FetchState.FETCHING);
                    break;
                default:
                    throw new IllegalStateException("unexpected fetch state " + machine.state);
            }
        }
        if (machine.state == FetchState.SUCCESS) {
            return new FetchAttempt(symbol, FetchState.SUCCESS, last.bag, attempts, null, "", "", machine.path);
        }
        FailureKind kind = last == null ? FailureKind.PERMANENT : last.failureKind;
        if (kind == FailureKind.TRANSIENT) {
            LOG.warn("Fetch failed for {} after {} attempts: {} {}",
                    symbol.ticker(), attempts, last.errorCategory, last.error);
        } else {
            LOG.info("No data for {}: {} {}", symbol.ticker(),
                    last == null ? "" : last.errorCategory, last == null ? "" : last.error);
        }
        return new FetchAttempt(
                symbol,
                FetchState.FAILED,
                null,
                attempts,
                kind,
                last == null ? "" : last.errorCategory,
                last == null ? "" : last.error,
                machine.path
        );
    }

    public int maxRetries() {
        return maxRetries;
    }

    private static final class Machine {
        private FetchState state = FetchState.PENDING;
        private final List<FetchState> path = new ArrayList<>(List.of(FetchState.PENDING));

        private void moveTo(FetchState next) {
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException("illegal fetch transition " + state + " -> " + next);
            }
            state = next;
            path.add(next);
        }
    }
}
