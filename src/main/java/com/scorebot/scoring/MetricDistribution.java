package com.scorebot.scoring;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Winsorized location and scale of one metric across the universe. Immutable once fitted.
 */
public final class MetricDistribution {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);
    private static final double ZERO_VARIANCE_EPS = 1e-12;

    private final int count;
    private final double lowerBound;
    private final double upperBound;
    private final double mean;
    private final double stdDev;
    private final double zClamp;

    private MetricDistribution(int count, double lowerBound, double upperBound, double mean, double stdDev, double zClamp) {
        this.count = count;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.mean = mean;
        this.stdDev = stdDev;
        this.zClamp = zClamp;
    }

    /**
     * Fits the distribution to the finite values in {@code values}; nulls and non-finite values are skipped.
     * With fewer than two usable values the result is degenerate and scores nothing.
     */
    public static MetricDistribution fit(Collection<Double> values, double lowerPct, double upperPct, double zClamp) {
        List<Double> finite = new ArrayList<>();
        if (values != null) {
            for (Double value : values) {
                if (value != null && Double.isFinite(value)) {
                    finite.add(value);
                }
            }
        }
        if (finite.size() < 2) {
            return new MetricDistribution(finite.size(), Double.NaN, Double.NaN, Double.NaN, Double.NaN, zClamp);
        }
        double[] data = new double[finite.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = finite.get(i);
        }
        double lower = percentile(data, lowerPct);
        double upper = percentile(data, upperPct);
        double[] clipped = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            clipped[i] = clip(data[i], lower, upper);
        }
        double mean = new Mean().evaluate(clipped);
        double std = new StandardDeviation(true).evaluate(clipped, mean);
        return new MetricDistribution(data.length, lower, upper, mean, std, zClamp);
    }

    /**
     * R-7 (linear interpolation between order statistics) percentile; 0 and 100 map to min and max.
     */
    static double percentile(double[] data, double pct) {
        if (pct <= 0.0) {
            double min = data[0];
            for (double v : data) {
                min = Math.min(min, v);
            }
            return min;
        }
        if (pct >= 100.0) {
            double max = data[0];
            for (double v : data) {
                max = Math.max(max, v);
            }
            return max;
        }
        Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return estimator.evaluate(data, pct);
    }

    public boolean degenerate() {
        return count < 2;
    }

    public boolean zeroVariance() {
        return !degenerate() && !(stdDev > ZERO_VARIANCE_EPS);
    }

    public int count() {
        return count;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    public double mean() {
        return mean;
    }

    public double stdDev() {
        return stdDev;
    }

    public Double winsorize(Double value) {
        if (value == null || !Double.isFinite(value) || degenerate()) {
            return null;
        }
        return clip(value, lowerBound, upperBound);
    }

    /**
     * @return the clamped z-score, 0 for a zero-variance metric, or null when there is nothing to score
     */
    public Double zScore(Double value) {
        Double clipped = winsorize(value);
        if (clipped == null) {
            return null;
        }
        if (zeroVariance()) {
            return 0.0;
        }
        double z = (clipped - mean) / stdDev;
        return clip(z, -zClamp, zClamp);
    }

    public Double percentileScore(Double value) {
        Double z = zScore(value);
        if (z == null) {
            return null;
        }
        return clip(STANDARD_NORMAL.cumulativeProbability(z) * 100.0, 0.0, 100.0);
    }

    private static double clip(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    @Override
    public String toString() {
        if (degenerate()) {
            return "MetricDistribution{n=" + count + ", degenerate}";
        }
        return String.format(Locale.US, "MetricDistribution{n=%d, bounds=[%.4f, %.4f], mean=%.4f, std=%.4f}",
                count, lowerBound, upperBound, mean, stdDev);
    }
}
