package com.scorebot.runner;

import com.scorebot.core.FakeTime;
import com.scorebot.core.NanoClock;
import com.scorebot.core.Sleeper;
import com.scorebot.data.FetchException;
import com.scorebot.data.MetricSource;
import com.scorebot.data.RateLimitedFetchClient;
import com.scorebot.data.RateLimiter;
import com.scorebot.model.FailureKind;
import com.scorebot.model.FetchState;
import com.scorebot.model.Metric;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import com.scorebot.model.SymbolOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolFetcherTest {

    private static final Symbol SYMBOL = Symbol.of("RETRY");

    @Test
    void fetch_shouldSpendWholeRetryBudgetOnPersistentTimeouts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MetricSource timingOut = symbol -> {
            calls.incrementAndGet();
            throw FetchException.transientFailure("timeout", "read timed out");
        };
        FakeTime time = new FakeTime();

        FetchAttempt attempt = fetcher(timingOut, 3, time).fetch(SYMBOL);

        assertEquals(4, attempt.attempts);
        assertEquals(4, calls.get());
        assertEquals(FetchState.FAILED, attempt.state);
        assertEquals(FailureKind.TRANSIENT, attempt.failureKind);
        assertEquals(SymbolOutcome.NO_DATA, attempt.outcome());
        assertTrue(attempt.transientFailure());
        assertEquals(List.of(100L, 200L, 400L), time.sleptMillis());
        assertEquals(List.of(
                FetchState.PENDING,
                FetchState.FETCHING, FetchState.BACKOFF,
                FetchState.FETCHING, FetchState.BACKOFF,
                FetchState.FETCHING, FetchState.BACKOFF,
                FetchState.FETCHING, FetchState.FAILED
        ), attempt.path);
    }

    @Test
    void fetch_shouldNotRetryPermanentFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MetricSource delisted = symbol -> {
            calls.incrementAndGet();
            throw FetchException.permanent("no_data", "unknown ticker");
        };
        FakeTime time = new FakeTime();

        FetchAttempt attempt = fetcher(delisted, 3, time).fetch(SYMBOL);

        assertEquals(1, attempt.attempts);
        assertEquals(1, calls.get());
        assertEquals(SymbolOutcome.NO_DATA, attempt.outcome());
        assertFalse(attempt.transientFailure());
        assertEquals("no_data: unknown ticker", attempt.reason());
        assertTrue(time.sleptMillis().isEmpty());
        assertNull(attempt.bag);
    }

    @Test
    void fetch_shouldSucceedAfterTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MetricSource flaky = symbol -> {
            if (calls.incrementAndGet() < 3) {
                throw FetchException.transientFailure("http_5xx", "http status=503");
            }
            return RawMetricBag.builder(symbol).put(Metric.BETA, 1.1).build();
        };

        FetchAttempt attempt = fetcher(flaky, 3, new FakeTime()).fetch(SYMBOL);

        assertTrue(attempt.succeeded());
        assertEquals(3, attempt.attempts);
        assertEquals(2, attempt.retries());
        assertNotNull(attempt.bag);
        assertEquals(SymbolOutcome.SUCCEEDED, attempt.outcome());
        assertEquals(FetchState.SUCCESS, attempt.path.get(attempt.path.size() - 1));
    }

    @Test
    void fetch_shouldAttemptOnceWhenRetriesDisabled() throws Exception {
        MetricSource timingOut = symbol -> {
            throw FetchException.transientFailure("timeout", "read timed out");
        };

        FetchAttempt attempt = fetcher(timingOut, 0, new FakeTime()).fetch(SYMBOL);

        assertEquals(1, attempt.attempts);
        assertEquals(List.of(FetchState.PENDING, FetchState.FETCHING, FetchState.FAILED), attempt.path);
    }

    private static SymbolFetcher fetcher(MetricSource source, int maxRetries, FakeTime time) {
        RateLimiter limiter = new RateLimiter(1_000, 1_000L, NanoClock.SYSTEM, Sleeper.SYSTEM);
        RateLimitedFetchClient client = new RateLimitedFetchClient(source, limiter, 5_000L, NanoClock.SYSTEM, time);
        BackoffPolicy backoff = new BackoffPolicy(100L, 10_000L, 0.0, new Random(7L));
        return new SymbolFetcher(client, backoff, maxRetries, time);
    }
}
