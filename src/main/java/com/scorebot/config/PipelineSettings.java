package com.scorebot.config;

import com.scorebot.model.Category;
import com.scorebot.model.Metric;
import com.scorebot.model.NormalizationScope;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Validated, typed view of the pipeline options held in {@link Config}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PipelineSettings {
    /** Hard ceiling on concurrent fetch workers, applied whatever the caller asks for. */
    public static final int WORKER_HARD_CAP = 8;
    /** Heap reserved per worker when deriving the memory ceiling. */
    public static final long PER_WORKER_HEAP_BYTES = 64L * 1024L * 1024L;
    public static final double WEIGHT_TOLERANCE = 1e-6;

    public final int workers;
    public final int batchSize;
    public final int maxRetries;
    public final long retryBaseDelayMs;
    public final long retryMaxDelayMs;
    public final double retryJitterRatio;
    public final long fetchTimeoutMs;
    public final int rateLimitRequests;
    public final long rateLimitWindowMs;
    public final Map<Category, Double> baseWeights;
    public final Map<Metric, Double> metricWeights;
    public final int minCategories;
    public final double winsorizeLowerPct;
    public final double winsorizeUpperPct;
    public final double zscoreClamp;
    public final boolean allowFallbackEstimates;
    public final NormalizationScope normalizationScope;
    public final int minSectorSize;
    public final int slowdownWindowBatches;
    public final double slowdownErrorRateThreshold;
    public final long slowdownStepMs;
    public final long slowdownMaxMs;
    public final boolean deferredRetryEnabled;
    public final int persistBatchSize;

    public static PipelineSettings from(Config config) {
        Map<Category, Double> weights = new EnumMap<>(Category.class);
        for (Category category : Category.compositeCategories()) {
            weights.put(category, config.getDouble("score.weight." + category.label(), 0.0));
        }
        Map<Metric, Double> metricWeights = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            metricWeights.put(metric, config.getDouble("score.metric_weight." + metric.key(), 1.0));
        }
        PipelineSettings settings = PipelineSettings.builder()
                .workers(config.getInt("scan.workers", 4))
                .batchSize(config.getInt("scan.batch_size", 25))
                .maxRetries(config.getInt("fetch.retry.max", 3))
                .retryBaseDelayMs(config.getLong("fetch.retry.base_delay_ms", 500L))
                .retryMaxDelayMs(config.getLong("fetch.retry.max_delay_ms", 30_000L))
                .retryJitterRatio(config.getDouble("fetch.retry.jitter_ratio", 0.2))
                .fetchTimeoutMs(config.getLong("fetch.timeout_ms", 20_000L))
                .rateLimitRequests(config.getInt("fetch.rate_limit.requests", 60))
                .rateLimitWindowMs(config.getLong("fetch.rate_limit.window_ms", 60_000L))
                .baseWeights(weights)
                .metricWeights(metricWeights)
                .minCategories(config.getInt("score.min_categories", 4))
                .winsorizeLowerPct(config.getDouble("score.winsorize.lower_pct", 1.0))
                .winsorizeUpperPct(config.getDouble("score.winsorize.upper_pct", 99.0))
                .zscoreClamp(config.getDouble("score.zscore_clamp", 3.0))
                .allowFallbackEstimates(config.getBoolean("score.allow_fallback_estimates", false))
                .normalizationScope(NormalizationScope.fromText(config.getString("score.normalization.scope", "universe")))
                .minSectorSize(config.getInt("score.normalization.min_sector_size", 3))
                .slowdownWindowBatches(config.getInt("scan.slowdown.window_batches", 3))
                .slowdownErrorRateThreshold(config.getDouble("scan.slowdown.error_rate_threshold", 0.5))
                .slowdownStepMs(config.getLong("scan.slowdown.step_ms", 250L))
                .slowdownMaxMs(config.getLong("scan.slowdown.max_ms", 5_000L))
                .deferredRetryEnabled(config.getBoolean("scan.deferred_retry.enabled", false))
                .persistBatchSize(config.getInt("persist.batch_size", 500))
                .build();
        settings.validate();
        return settings;
    }

    public static PipelineSettings defaults() {
        return from(Config.ofOverrides(Path.of("."), Map.of()));
    }

    /**
     * @throws IllegalArgumentException when an option is out of range or the weights do not sum to 1
     */
    public PipelineSettings validate() {
        require(workers >= 1, "scan.workers must be >= 1");
        require(batchSize >= 1, "scan.batch_size must be >= 1");
        require(maxRetries >= 0, "fetch.retry.max must be >= 0");
        require(retryBaseDelayMs >= 0L, "fetch.retry.base_delay_ms must be >= 0");
        require(retryMaxDelayMs >= retryBaseDelayMs, "fetch.retry.max_delay_ms must be >= base delay");
        require(retryJitterRatio >= 0.0 && retryJitterRatio <= 1.0, "fetch.retry.jitter_ratio must be in [0,1]");
        require(fetchTimeoutMs > 0L, "fetch.timeout_ms must be > 0");
        require(rateLimitRequests >= 1, "fetch.rate_limit.requests must be >= 1");
        require(rateLimitWindowMs > 0L, "fetch.rate_limit.window_ms must be > 0");
        require(minCategories >= 1 && minCategories <= Category.compositeCategories().size(),
                "score.min_categories must be in [1," + Category.compositeCategories().size() + "]");
        require(winsorizeLowerPct >= 0.0 && winsorizeUpperPct <= 100.0 && winsorizeLowerPct < winsorizeUpperPct,
                "score.winsorize bounds must satisfy 0 <= lower < upper <= 100");
        require(zscoreClamp > 0.0 && Double.isFinite(zscoreClamp), "score.zscore_clamp must be > 0");
        require(normalizationScope != null, "score.normalization.scope must be set");
        require(minSectorSize >= 2, "score.normalization.min_sector_size must be >= 2");
        require(slowdownWindowBatches >= 1, "scan.slowdown.window_batches must be >= 1");
        require(persistBatchSize >= 1, "persist.batch_size must be >= 1");
        validateWeights(baseWeights);
        if (metricWeights != null) {
            for (Map.Entry<Metric, Double> entry : metricWeights.entrySet()) {
                double weight = entry.getValue() == null ? 0.0 : entry.getValue();
                require(weight >= 0.0 && Double.isFinite(weight),
                        "score.metric_weight." + entry.getKey().key() + " must be >= 0");
            }
        }
        return this;
    }

    public double metricWeight(Metric metric) {
        if (metricWeights == null) {
            return 1.0;
        }
        Double weight = metricWeights.get(metric);
        return weight == null ? 1.0 : weight;
    }

    /**
     * Caps requested concurrency by {@link #WORKER_HARD_CAP} and by what the heap can hold.
     */
    public static int capWorkers(int requested, long maxHeapBytes) {
        int memoryCap = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, maxHeapBytes / PER_WORKER_HEAP_BYTES));
        return Math.max(1, Math.min(Math.min(requested, WORKER_HARD_CAP), memoryCap));
    }

    static void validateWeights(Map<Category, Double> weights) {
        require(weights != null && !weights.isEmpty(), "score.weight.* must be configured");
        double sum = 0.0;
        for (Map.Entry<Category, Double> entry : weights.entrySet()) {
            Category category = entry.getKey();
            double weight = entry.getValue() == null ? Double.NaN : entry.getValue();
            require(category.compositeEligible(), "category " + category.label() + " cannot carry a composite weight");
            require(Double.isFinite(weight) && weight >= 0.0, "score.weight." + category.label() + " must be >= 0");
            sum += weight;
        }
        require(Math.abs(sum - 1.0) <= WEIGHT_TOLERANCE,
                String.format(Locale.US, "score.weight.* must sum to 1.0 (got %.6f)", sum));
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
