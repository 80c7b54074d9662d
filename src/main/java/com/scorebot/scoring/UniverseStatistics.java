package com.scorebot.scoring;

import com.scorebot.model.Metric;
import com.scorebot.model.NormalizationScope;
import com.scorebot.model.RawMetricBag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-metric distributions over the whole fetched universe and, with sector scope, over each
 * sector. Built once after every fetch has finished and read concurrently afterwards, so it
 * holds no mutable state.
 */
public final class UniverseStatistics {
    private final Map<Metric, MetricDistribution> distributions;
    private final Map<String, Map<Metric, MetricDistribution>> sectorDistributions;
    private final NormalizationScope scope;
    private final int universeSize;

    private UniverseStatistics(
            Map<Metric, MetricDistribution> distributions,
            Map<String, Map<Metric, MetricDistribution>> sectorDistributions,
            NormalizationScope scope,
            int universeSize
    ) {
        this.distributions = Collections.unmodifiableMap(distributions);
        this.sectorDistributions = Collections.unmodifiableMap(sectorDistributions);
        this.scope = scope;
        this.universeSize = universeSize;
    }

    public static UniverseStatistics compute(Iterable<RawMetricBag> bagsInTickerOrder, MetricNormalizer normalizer) {
        return compute(bagsInTickerOrder, normalizer, NormalizationScope.UNIVERSE, 2);
    }

    /**
     * @param bagsInTickerOrder every fetched bag; iteration order fixes floating-point summation order
     * @param minSectorSize     fewest non-null values a sector needs before a metric is fitted for it
     */
    public static UniverseStatistics compute(
            Iterable<RawMetricBag> bagsInTickerOrder,
            MetricNormalizer normalizer,
            NormalizationScope scope,
            int minSectorSize
    ) {
        NormalizationScope effective = scope == null ? NormalizationScope.UNIVERSE : scope;
        Map<Metric, List<Double>> columns = emptyColumns();
        Map<String, Map<Metric, List<Double>>> sectorColumns = new TreeMap<>();
        int size = 0;
        for (RawMetricBag bag : bagsInTickerOrder) {
            size++;
            String sector = sectorKey(bag.symbol().sector());
            Map<Metric, List<Double>> peers = null;
            if (effective == NormalizationScope.SECTOR && sector != null) {
                peers = sectorColumns.computeIfAbsent(sector, k -> emptyColumns());
            }
            for (Metric metric : Metric.values()) {
                Double raw = bag.get(metric);
                if (raw == null) {
                    continue;
                }
                double oriented = metric.oriented(raw);
                columns.get(metric).add(oriented);
                if (peers != null) {
                    peers.get(metric).add(oriented);
                }
            }
        }
        Map<Metric, MetricDistribution> fitted = new EnumMap<>(Metric.class);
        for (Map.Entry<Metric, List<Double>> entry : columns.entrySet()) {
            fitted.put(entry.getKey(), normalizer.fit(entry.getValue()));
        }
        int threshold = Math.max(2, minSectorSize);
        Map<String, Map<Metric, MetricDistribution>> bySector = new TreeMap<>();
        for (Map.Entry<String, Map<Metric, List<Double>>> sectorEntry : sectorColumns.entrySet()) {
            Map<Metric, MetricDistribution> sectorFitted = new EnumMap<>(Metric.class);
            for (Map.Entry<Metric, List<Double>> entry : sectorEntry.getValue().entrySet()) {
                if (entry.getValue().size() >= threshold) {
                    sectorFitted.put(entry.getKey(), normalizer.fit(entry.getValue()));
                }
            }
            bySector.put(sectorEntry.getKey(), Collections.unmodifiableMap(sectorFitted));
        }
        return new UniverseStatistics(fitted, bySector, effective, size);
    }

    public MetricDistribution distribution(Metric metric) {
        return distributions.get(metric);
    }

    /**
     * Distribution of {@code metric} within {@code sector}, or null when the sector has too few values.
     */
    public MetricDistribution sectorDistribution(String sector, Metric metric) {
        String key = sectorKey(sector);
        Map<Metric, MetricDistribution> fitted = key == null ? null : sectorDistributions.get(key);
        return fitted == null ? null : fitted.get(metric);
    }

    /**
     * Percentile score of a raw (un-oriented) value, or null when the value or the metric's
     * distribution cannot produce one.
     */
    public Double percentile(Metric metric, Double raw) {
        if (raw == null || !Double.isFinite(raw)) {
            return null;
        }
        MetricDistribution distribution = distributions.get(metric);
        return distribution == null ? null : distribution.percentileScore(metric.oriented(raw));
    }

    /**
     * Percentile against the symbol's peer group. Under sector scope a symbol without a sector
     * is scored against the universe; a sector too thin for the metric yields null.
     */
    public Double percentile(String sector, Metric metric, Double raw) {
        String key = sectorKey(sector);
        if (scope != NormalizationScope.SECTOR || key == null) {
            return percentile(metric, raw);
        }
        if (raw == null || !Double.isFinite(raw)) {
            return null;
        }
        MetricDistribution distribution = sectorDistribution(key, metric);
        return distribution == null ? null : distribution.percentileScore(metric.oriented(raw));
    }

    public NormalizationScope scope() {
        return scope;
    }

    public int sectorCount() {
        return sectorDistributions.size();
    }

    public int universeSize() {
        return universeSize;
    }

    private static Map<Metric, List<Double>> emptyColumns() {
        Map<Metric, List<Double>> columns = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            columns.put(metric, new ArrayList<>());
        }
        return columns;
    }

    private static String sectorKey(String sector) {
        if (sector == null || sector.trim().isEmpty()) {
            return null;
        }
        return sector.trim().toLowerCase(Locale.ROOT);
    }
}
