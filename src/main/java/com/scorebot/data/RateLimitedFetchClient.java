package com.scorebot.data;

import com.scorebot.config.PipelineSettings;
import com.scorebot.core.NanoClock;
import com.scorebot.core.Sleeper;
import com.scorebot.model.FailureKind;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-attempt provider client: takes a rate-limit slot, enforces the call timeout and
 * classifies failures. Retrying is the caller's job.
 */
public final class RateLimitedFetchClient implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(RateLimitedFetchClient.class);

    private final MetricSource source;
    private final RateLimiter rateLimiter;
    private final long timeoutMs;
    private final NanoClock clock;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;
    private final AtomicLong extraPauseMs = new AtomicLong(0L);

    public RateLimitedFetchClient(
            MetricSource source,
            RateLimiter rateLimiter,
            long timeoutMs,
            NanoClock clock,
            Sleeper sleeper
    ) {
        this(source, rateLimiter, timeoutMs, clock, sleeper, PipelineSettings.WORKER_HARD_CAP);
    }

    /**
     * @param maxCallThreads upper bound on threads running provider calls, hung ones included.
     *                       Calls beyond it wait in a queue and still time out on schedule.
     */
    public RateLimitedFetchClient(
            MetricSource source,
            RateLimiter rateLimiter,
            long timeoutMs,
            NanoClock clock,
            Sleeper sleeper,
            int maxCallThreads
    ) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter must not be null");
        }
        this.source = source;
        this.rateLimiter = rateLimiter;
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.clock = clock == null ? NanoClock.SYSTEM : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        int threads = Math.max(1, maxCallThreads);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads, 30L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), new CallThreadFactory());
        executor.allowCoreThreadTimeOut(true);
        this.callExecutor = executor;
    }

    public FetchResult fetch(Symbol symbol) throws InterruptedException {
        long pause = extraPauseMs.get();
        if (pause > 0L) {
            sleeper.sleepMillis(pause);
        }
        rateLimiter.acquire();
        long started = clock.nanoTime();
        Future<RawMetricBag> future = callExecutor.submit(() -> source.fetch(symbol));
        try {
            RawMetricBag bag = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            long latency = clock.nanoTime() - started;
            if (bag == null || bag.isEmpty()) {
                return FetchResult.failed(FailureKind.PERMANENT, "no_data", "no metrics returned", latency);
            }
            return FetchResult.success(bag, latency);
        } catch (TimeoutException e) {
            future.cancel(true);
            return FetchResult.failed(
                    FailureKind.TRANSIENT,
                    "timeout",
                    "fetch timed out after " + timeoutMs + "ms",
                    clock.nanoTime() - started
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            FetchException classified = classify(cause);
            return FetchResult.failed(
                    classified.kind(),
                    classified.category(),
                    classified.getMessage(),
                    clock.nanoTime() - started
            );
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Maps any provider-side throwable onto the transient/permanent taxonomy.
     */
    public static FetchException classify(Throwable error) {
        if (error instanceof FetchException fetchError) {
            return fetchError;
        }
        String message = error == null || error.getMessage() == null
                ? (error == null ? "unknown" : error.getClass().getSimpleName())
                : error.getMessage();
        if (error instanceof SocketTimeoutException || error instanceof HttpTimeoutException) {
            return new FetchException(FailureKind.TRANSIENT, "timeout", message, error);
        }
        if (error instanceof ConnectException) {
            return new FetchException(FailureKind.TRANSIENT, "connection", message, error);
        }
        if (error instanceof IOException) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("timed out") || lower.contains("timeout")) {
                return new FetchException(FailureKind.TRANSIENT, "timeout", message, error);
            }
            return new FetchException(FailureKind.TRANSIENT, "io", message, error);
        }
        if (error instanceof JSONException
                || error instanceof NumberFormatException
                || error instanceof IllegalArgumentException) {
            return new FetchException(FailureKind.PERMANENT, "parse_error", message, error);
        }
        return new FetchException(FailureKind.PERMANENT, "other", message, error);
    }

    /**
     * Adds {@code stepMs} to the pause taken before every request, up to {@code maxMs}.
     */
    public long raisePause(long stepMs, long maxMs) {
        long next = extraPauseMs.updateAndGet(prev -> Math.min(Math.max(0L, maxMs),
                prev <= 0L ? Math.max(0L, stepMs) : prev * 2L));
        LOG.warn("Fetch slow-down raised: pause={}ms", next);
        return next;
    }

    public long relaxPause() {
        long prev = extraPauseMs.get();
        if (prev <= 0L) {
            return 0L;
        }
        long next = extraPauseMs.updateAndGet(p -> p / 2L);
        LOG.info("Fetch slow-down relaxed: pause={}ms", next);
        return next;
    }

    public long currentPauseMs() {
        return extraPauseMs.get();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "fetch-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
