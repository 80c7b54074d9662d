package com.scorebot.runner;

import com.scorebot.config.PipelineSettings;
import com.scorebot.core.NanoClock;
import com.scorebot.core.RunTelemetry;
import com.scorebot.core.Sleeper;
import com.scorebot.data.MetricSource;
import com.scorebot.data.RateLimitedFetchClient;
import com.scorebot.data.RateLimiter;
import com.scorebot.db.ScoreStore;
import com.scorebot.db.UpsertResult;
import com.scorebot.model.Category;
import com.scorebot.model.CategoryScores;
import com.scorebot.model.CompositeScore;
import com.scorebot.model.Metric;
import com.scorebot.model.NormalizationScope;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.RunSummary;
import com.scorebot.model.ScoreRecord;
import com.scorebot.model.Symbol;
import com.scorebot.model.SymbolOutcome;
import com.scorebot.scoring.CategoryScorer;
import com.scorebot.scoring.CompositeCalculator;
import com.scorebot.scoring.FallbackEstimator;
import com.scorebot.scoring.MetricNormalizer;
import com.scorebot.scoring.PercentileRanker;
import com.scorebot.scoring.ScoreValidationException;
import com.scorebot.scoring.ScoreValidator;
import com.scorebot.scoring.UniverseStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * One scoring run: fetch the universe, fit universe statistics once every fetch is in,
 * score each symbol against that fixed snapshot, then upsert.
 */
public final class ScoringPipeline {
    private static final Logger LOG = LogManager.getLogger(ScoringPipeline.class);

    private final PipelineSettings settings;
    private final MetricSource source;
    private final ScoreStore store;
    private final NanoClock clock;
    private final Sleeper sleeper;
    private final Random random;

    /**
     * @param store destination for records, or null to score without writing
     */
    public ScoringPipeline(
            PipelineSettings settings,
            MetricSource source,
            ScoreStore store,
            NanoClock clock,
            Sleeper sleeper,
            Random random
    ) {
        this.settings = settings;
        this.source = source;
        this.store = store;
        this.clock = clock == null ? NanoClock.SYSTEM : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.random = random == null ? new Random() : random;
    }

    public ScoringPipeline(PipelineSettings settings, MetricSource source, ScoreStore store) {
        this(settings, source, store, NanoClock.SYSTEM, Sleeper.SYSTEM, new Random());
    }

    public PipelineResult run(List<Symbol> universe, LocalDate asOfDate, int requestedWorkers)
            throws InterruptedException {
        RunTelemetry telemetry = new RunTelemetry(store == null ? "DRY_RUN" : "SCORE", asOfDate, Instant.now());
        long started = System.nanoTime();
        List<Symbol> symbols = universe == null ? List.of() : universe;

        telemetry.startStep(RunTelemetry.STEP_FETCH);
        FetchPhaseResult fetched = fetchAll(symbols, requestedWorkers);
        int failedFetches = fetched.failures().size();
        telemetry.endStep(RunTelemetry.STEP_FETCH, symbols.size(), fetched.bags().size(), failedFetches);
        if (fetched.deferredRecovered > 0) {
            telemetry.note(RunTelemetry.STEP_FETCH, "deferred_recovered=" + fetched.deferredRecovered);
        }

        telemetry.startStep(RunTelemetry.STEP_NORMALIZE);
        FallbackEstimator estimator = new FallbackEstimator(settings.allowFallbackEstimates);
        List<RawMetricBag> bags = new ArrayList<>(fetched.bags().size());
        for (RawMetricBag bag : fetched.bags().values()) {
            bags.add(estimator.apply(bag));
        }
        UniverseStatistics statistics = UniverseStatistics.compute(
                bags, MetricNormalizer.from(settings), settings.normalizationScope, settings.minSectorSize);
        telemetry.endStep(RunTelemetry.STEP_NORMALIZE, bags.size(), Metric.values().length, 0);
        if (statistics.scope() == NormalizationScope.SECTOR) {
            telemetry.note(RunTelemetry.STEP_NORMALIZE, "scope=sector sectors=" + statistics.sectorCount());
        }

        telemetry.startStep(RunTelemetry.STEP_SCORE);
        ScoredBatch scored = score(bags, statistics, asOfDate);
        telemetry.endStep(RunTelemetry.STEP_SCORE, bags.size(), scored.records.size(), scored.validationFailed);

        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        UpsertResult persisted = persist(scored.records);
        telemetry.endStep(RunTelemetry.STEP_PERSIST, scored.records.size(), persisted.written, persisted.failed);
        telemetry.finish();

        Map<String, String> failedSymbols = new LinkedHashMap<>(fetched.failureReasons());
        failedSymbols.putAll(scored.validationFailures);
        for (Map.Entry<String, String> entry : persisted.failures.entrySet()) {
            String reason = entry.getValue();
            failedSymbols.put(entry.getKey(), reason.startsWith("persist_failed") ? reason : "persist_failed " + reason);
        }
        RunSummary summary = RunSummary.builder()
                .asOfDate(asOfDate)
                .universeSize(symbols.size())
                .workers(fetched.workers)
                .succeeded(fetched.count(SymbolOutcome.SUCCEEDED))
                .noData(fetched.count(SymbolOutcome.NO_DATA))
                .errored(fetched.count(SymbolOutcome.ERRORED))
                .scored(scored.records.size())
                .compositeNull(scored.compositeNull)
                .validationFailed(scored.validationFailed)
                .persisted(persisted.written)
                .persistFailed(persisted.failed)
                .elapsedMs((System.nanoTime() - started) / 1_000_000L)
                .failedSymbols(failedSymbols)
                .batches(fetched.batches)
                .build();
        LOG.info(summary.toLogLine());
        LOG.info(summary.toJson().toString());
        return new PipelineResult(summary, scored.records, telemetry);
    }

    private FetchPhaseResult fetchAll(List<Symbol> symbols, int requestedWorkers) throws InterruptedException {
        RateLimiter limiter = new RateLimiter(settings.rateLimitRequests, settings.rateLimitWindowMs, clock, sleeper);
        int callThreads = PipelineSettings.capWorkers(requestedWorkers, Runtime.getRuntime().maxMemory());
        try (RateLimitedFetchClient client = new RateLimitedFetchClient(
                source, limiter, settings.fetchTimeoutMs, clock, sleeper, callThreads)) {
            SymbolFetcher fetcher = new SymbolFetcher(
                    client, BackoffPolicy.from(settings, random), settings.maxRetries, sleeper);
            return new BatchScheduler(fetcher, client, settings).run(symbols, requestedWorkers);
        }
    }

    ScoredBatch score(List<RawMetricBag> bags, UniverseStatistics statistics, LocalDate asOfDate) {
        CategoryScorer scorer = new CategoryScorer(statistics, settings);
        CompositeCalculator calculator = CompositeCalculator.from(settings);
        Map<String, ScoreRecord> drafts = new LinkedHashMap<>();
        Map<String, Double> composites = new LinkedHashMap<>();
        Map<String, String> validationFailures = new LinkedHashMap<>();
        for (RawMetricBag bag : bags) {
            String ticker = bag.symbol().ticker();
            try {
                CategoryScores all = scorer.score(bag);
                Map<Category, Double> factorScores = new EnumMap<>(Category.class);
                for (Map.Entry<Category, Double> entry : all.asMap().entrySet()) {
                    if (entry.getKey().compositeEligible()) {
                        factorScores.put(entry.getKey(), entry.getValue());
                    }
                }
                CompositeScore composite = calculator.combine(factorScores, settings.baseWeights);
                List<String> estimated = new ArrayList<>();
                for (Metric metric : bag.estimatedMetrics()) {
                    estimated.add(metric.key());
                }
                drafts.put(ticker, ScoreRecord.builder()
                        .symbol(ticker)
                        .asOfDate(asOfDate)
                        .compositeScore(composite.value())
                        .categoryScores(new CategoryScores(factorScores))
                        .sentimentScore(all.get(Category.SENTIMENT))
                        .appliedWeights(composite.appliedWeights())
                        .metricInputs(bag.asKeyedMap())
                        .estimatedMetrics(estimated)
                        .completenessRatio(CategoryScorer.completeness(bag))
                        .build());
                composites.put(ticker, composite.value());
            } catch (ScoreValidationException e) {
                LOG.error("Score validation failed for {}; record skipped: {}", ticker, e.getMessage());
                validationFailures.put(ticker, "validation_failed " + e.getMessage());
            }
        }

        Map<String, Double> ranks = PercentileRanker.rank(composites);
        List<ScoreRecord> records = new ArrayList<>(drafts.size());
        int compositeNull = 0;
        for (ScoreRecord draft : drafts.values()) {
            ScoreRecord record = draft.toBuilder().compositePercentileRank(ranks.get(draft.symbol)).build();
            try {
                ScoreValidator.validate(record);
            } catch (ScoreValidationException e) {
                LOG.error("Score validation failed for {}; record skipped: {}", record.symbol, e.getMessage());
                validationFailures.put(record.symbol, "validation_failed " + e.getMessage());
                continue;
            }
            if (record.compositeScore == null) {
                compositeNull++;
            }
            records.add(record);
        }
        return new ScoredBatch(records, compositeNull, validationFailures);
    }

    private UpsertResult persist(List<ScoreRecord> records) {
        if (store == null) {
            LOG.info("Dry run: {} score records not written", records.size());
            return UpsertResult.empty();
        }
        if (records.isEmpty()) {
            return UpsertResult.empty();
        }
        try {
            UpsertResult result = store.upsertAll(records, settings.persistBatchSize);
            if (result.failed > 0) {
                LOG.warn("Score upsert: written={} failed={}", result.written, result.failed);
            }
            return result;
        } catch (SQLException e) {
            LOG.error("Score upsert aborted, {} records not written: {}", records.size(), e.getMessage(), e);
            Map<String, String> failures = new LinkedHashMap<>();
            for (ScoreRecord record : records) {
                failures.put(record.symbol, "persist_failed " + e.getMessage());
            }
            return new UpsertResult(0, records.size(), failures);
        }
    }

    static final class ScoredBatch {
        final List<ScoreRecord> records;
        final int compositeNull;
        final int validationFailed;
        final Map<String, String> validationFailures;

        ScoredBatch(List<ScoreRecord> records, int compositeNull, Map<String, String> validationFailures) {
            this.records = List.copyOf(records);
            this.compositeNull = compositeNull;
            this.validationFailed = validationFailures.size();
            this.validationFailures = validationFailures;
        }
    }
}
