package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Metric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps a universe's raw values for one metric onto 0-100 percentile scores: winsorize,
 * z-score with a clamp, then the standard normal CDF. Output is aligned with input and
 * a null input stays null.
 */
public final class MetricNormalizer {
    private final double lowerPct;
    private final double upperPct;
    private final double zClamp;

    public MetricNormalizer(double lowerPct, double upperPct, double zClamp) {
        if (!(lowerPct >= 0.0 && upperPct <= 100.0 && lowerPct < upperPct)) {
            throw new IllegalArgumentException("winsorize bounds must satisfy 0 <= lower < upper <= 100");
        }
        if (!(zClamp > 0.0)) {
            throw new IllegalArgumentException("zClamp must be > 0");
        }
        this.lowerPct = lowerPct;
        this.upperPct = upperPct;
        this.zClamp = zClamp;
    }

    public static MetricNormalizer from(PipelineSettings settings) {
        return new MetricNormalizer(settings.winsorizeLowerPct, settings.winsorizeUpperPct, settings.zscoreClamp);
    }

    /**
     * Fits on values already oriented so that higher is better.
     */
    public MetricDistribution fit(List<Double> orientedValues) {
        return MetricDistribution.fit(orientedValues, lowerPct, upperPct, zClamp);
    }

    /**
     * Normalizes raw values of {@code metric}; lower-is-better metrics are negated first.
     */
    public List<Double> normalize(Metric metric, List<Double> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return List.of();
        }
        List<Double> oriented = orient(metric, rawValues);
        MetricDistribution distribution = fit(oriented);
        List<Double> out = new ArrayList<>(oriented.size());
        for (Double value : oriented) {
            out.add(distribution.percentileScore(value));
        }
        return Collections.unmodifiableList(out);
    }

    static List<Double> orient(Metric metric, List<Double> rawValues) {
        List<Double> out = new ArrayList<>(rawValues.size());
        for (Double raw : rawValues) {
            out.add(raw == null || !Double.isFinite(raw) ? null : metric.oriented(raw));
        }
        return out;
    }

    public double zClamp() {
        return zClamp;
    }
}
