package com.scorebot.runner;

import com.scorebot.config.PipelineSettings;
import com.scorebot.data.RateLimitedFetchClient;
import com.scorebot.model.BatchRun;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import com.scorebot.model.SymbolOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Fetches the universe in fixed-size batches on a bounded worker pool. One symbol's failure
 * never stops its batch or the run.
 */
public final class BatchScheduler {
    private static final Logger LOG = LogManager.getLogger(BatchScheduler.class);

    private final SymbolFetcher fetcher;
    private final RateLimitedFetchClient client;
    private final PipelineSettings settings;
    private final LongSupplier maxHeapBytes;

    public BatchScheduler(SymbolFetcher fetcher, RateLimitedFetchClient client, PipelineSettings settings) {
        this(fetcher, client, settings, () -> Runtime.getRuntime().maxMemory());
    }

    BatchScheduler(
            SymbolFetcher fetcher,
            RateLimitedFetchClient client,
            PipelineSettings settings,
            LongSupplier maxHeapBytes
    ) {
        this.fetcher = fetcher;
        this.client = client;
        this.settings = settings;
        this.maxHeapBytes = maxHeapBytes;
    }

    public FetchPhaseResult run(List<Symbol> symbols, int requestedWorkers) throws InterruptedException {
        int workers = PipelineSettings.capWorkers(requestedWorkers, maxHeapBytes.getAsLong());
        if (workers < requestedWorkers) {
            LOG.warn("Worker count capped: requested={} effective={} hard_cap={}",
                    requestedWorkers, workers, PipelineSettings.WORKER_HARD_CAP);
        }
        Map<Symbol, RawMetricBag> bags = new ConcurrentHashMap<>();
        Map<Symbol, FetchAttempt> failures = new ConcurrentHashMap<>();
        List<BatchRun> batches = new ArrayList<>();
        if (symbols == null || symbols.isEmpty()) {
            return new FetchPhaseResult(workers, batches, bags, failures, 0);
        }

        List<List<Symbol>> partitions = partition(symbols, settings.batchSize);
        Deque<BatchRun> window = new ArrayDeque<>();
        long startedNanos = System.nanoTime();
        int done = 0;
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        int deferredRecovered = 0;
        try {
            for (int i = 0; i < partitions.size(); i++) {
                List<Symbol> batch = partitions.get(i);
                BatchRun run = runBatch(pool, i + 1, batch, bags, failures);
                batches.add(run);
                done += batch.size();
                logProgress(run, partitions.size(), done, symbols.size(), startedNanos);
                adjustPace(window, run);
            }
            if (settings.deferredRetryEnabled) {
                deferredRecovered = runDeferredPass(pool, partitions.size() + 1, bags, failures, batches);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }
        return new FetchPhaseResult(workers, batches, bags, failures, deferredRecovered);
    }

    private BatchRun runBatch(
            ExecutorService pool,
            int batchId,
            List<Symbol> batch,
            Map<Symbol, RawMetricBag> bags,
            Map<Symbol, FetchAttempt> failures
    ) throws InterruptedException {
        long started = System.nanoTime();
        CompletionService<FetchAttempt> completion = new ExecutorCompletionService<>(pool);
        Map<Future<FetchAttempt>, Symbol> submitted = new LinkedHashMap<>();
        for (Symbol symbol : batch) {
            submitted.put(completion.submit(() -> fetcher.fetch(symbol)), symbol);
        }
        int succeeded = 0;
        int noData = 0;
        int errored = 0;
        int transientFailures = 0;
        Map<String, String> reasons = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            Future<FetchAttempt> future = completion.take();
            FetchAttempt attempt;
            try {
                attempt = future.get();
            } catch (ExecutionException e) {
                Symbol symbol = submitted.get(future);
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.error("Fetch worker failed for {}", symbol.ticker(), cause);
                attempt = FetchAttempt.crashed(symbol, cause);
            }
            SymbolOutcome outcome = attempt.outcome();
            if (outcome == SymbolOutcome.SUCCEEDED) {
                bags.put(attempt.symbol, attempt.bag);
                failures.remove(attempt.symbol);
                succeeded++;
            } else {
                failures.put(attempt.symbol, attempt);
                reasons.put(attempt.symbol.ticker(), attempt.reason());
                if (outcome == SymbolOutcome.NO_DATA) {
                    noData++;
                } else {
                    errored++;
                }
                if (attempt.transientFailure()) {
                    transientFailures++;
                }
            }
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        return new BatchRun(batchId, batch.size(), succeeded, noData, errored, transientFailures, reasons, elapsedMs);
    }

    /**
     * Re-runs symbols that ended on a transient failure, once, after every batch has finished.
     */
    private int runDeferredPass(
            ExecutorService pool,
            int batchId,
            Map<Symbol, RawMetricBag> bags,
            Map<Symbol, FetchAttempt> failures,
            List<BatchRun> batches
    ) throws InterruptedException {
        List<Symbol> retry = new ArrayList<>();
        for (FetchAttempt attempt : failures.values()) {
            if (attempt.transientFailure()) {
                retry.add(attempt.symbol);
            }
        }
        if (retry.isEmpty()) {
            return 0;
        }
        retry.sort((a, b) -> a.ticker().compareTo(b.ticker()));
        LOG.info("Deferred retry pass: symbols={}", retry.size());
        BatchRun run = runBatch(pool, batchId, retry, bags, failures);
        batches.add(run);
        LOG.info("Deferred retry pass done: recovered={} still_failed={}", run.succeeded, run.noData + run.errored);
        return run.succeeded;
    }

    private void adjustPace(Deque<BatchRun> window, BatchRun latest) {
        window.addLast(latest);
        while (window.size() > settings.slowdownWindowBatches) {
            window.removeFirst();
        }
        int attempted = 0;
        int failed = 0;
        for (BatchRun run : window) {
            attempted += run.attempted;
            failed += run.transientFailures + run.errored;
        }
        double rate = attempted <= 0 ? 0.0 : failed / (double) attempted;
        if (rate > settings.slowdownErrorRateThreshold) {
            LOG.warn(String.format(Locale.US, "Error rate %.2f over last %d batches exceeds %.2f",
                    rate, window.size(), settings.slowdownErrorRateThreshold));
            client.raisePause(settings.slowdownStepMs, settings.slowdownMaxMs);
        } else if (client.currentPauseMs() > 0L) {
            client.relaxPause();
        }
    }

    private void logProgress(BatchRun run, int batchCount, int done, int total, long startedNanos) {
        long elapsedSec = Math.max(0L, Math.round((System.nanoTime() - startedNanos) / 1_000_000_000.0));
        int remaining = Math.max(0, total - done);
        long etaSec = done <= 0 ? 0L : Math.round(elapsedSec * (remaining / (double) done));
        double pct = total <= 0 ? 100.0 : done * 100.0 / total;
        LOG.info(String.format(
                Locale.US,
                "Progress batch %d/%d done=%d/%d (%.1f%%) succeeded=%d no_data=%d errored=%d elapsed=%s eta=%s",
                run.batchId,
                batchCount,
                done,
                total,
                pct,
                run.succeeded,
                run.noData,
                run.errored,
                formatSeconds(elapsedSec),
                formatSeconds(etaSec)
        ));
    }

    static List<List<Symbol>> partition(List<Symbol> symbols, int batchSize) {
        int size = Math.max(1, batchSize);
        List<List<Symbol>> out = new ArrayList<>();
        for (int from = 0; from < symbols.size(); from += size) {
            out.add(List.copyOf(symbols.subList(from, Math.min(symbols.size(), from + size))));
        }
        return out;
    }

    private static String formatSeconds(long totalSec) {
        long sec = Math.max(0L, totalSec);
        long h = sec / 3600L;
        long m = (sec % 3600L) / 60L;
        long s = sec % 60L;
        if (h > 0L) {
            return String.format(Locale.US, "%dh%02dm%02ds", h, m, s);
        }
        if (m > 0L) {
            return String.format(Locale.US, "%dm%02ds", m, s);
        }
        return s + "s";
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "score-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
