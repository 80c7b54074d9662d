package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Category;
import com.scorebot.model.CategoryScores;
import com.scorebot.model.Metric;
import com.scorebot.model.RawMetricBag;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a symbol's raw metrics into per-category scores against the universe statistics.
 */
public final class CategoryScorer {
    private static final List<Metric> COMPOSITE_METRICS = Metric.compositeEligible();

    private final UniverseStatistics statistics;
    private final PipelineSettings settings;

    public CategoryScorer(UniverseStatistics statistics, PipelineSettings settings) {
        this.statistics = statistics;
        this.settings = settings;
    }

    /**
     * Scores every category, sentiment included. Categories with no usable metric are left out.
     */
    public CategoryScores score(RawMetricBag bag) {
        Map<Category, Double> out = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            Double score = scoreCategory(bag, category);
            if (score != null) {
                out.put(category, score);
            }
        }
        return new CategoryScores(out);
    }

    /**
     * Weighted average of the category's available metric percentiles, or null when none is available.
     */
    public Double scoreCategory(RawMetricBag bag, Category category) {
        double weightedSum = 0.0;
        double weightSum = 0.0;
        for (Metric metric : Metric.ofCategory(category)) {
            Double percentile = statistics.percentile(bag.symbol().sector(), metric, bag.get(metric));
            if (percentile == null) {
                continue;
            }
            double weight = settings.metricWeight(metric);
            if (weight <= 0.0) {
                continue;
            }
            weightedSum += percentile * weight;
            weightSum += weight;
        }
        if (weightSum <= 0.0) {
            return null;
        }
        double score = weightedSum / weightSum;
        if (score < 0.0) {
            return 0.0;
        }
        return Math.min(100.0, score);
    }

    /**
     * Share of composite-eligible metrics the bag carries.
     */
    public static double completeness(RawMetricBag bag) {
        int present = 0;
        for (Metric metric : COMPOSITE_METRICS) {
            if (bag.has(metric)) {
                present++;
            }
        }
        return COMPOSITE_METRICS.isEmpty() ? 0.0 : present / (double) COMPOSITE_METRICS.size();
    }
}
