package com.scorebot.scoring;

import com.scorebot.model.Metric;
import com.scorebot.model.RawMetricBag;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fills selected missing metrics with estimates derived from metrics the bag does carry.
 * Only used when {@code score.allow_fallback_estimates} is on; estimates are flagged in the audit inputs.
 */
public final class FallbackEstimator {
    /** Payout ratio assumed when deriving sustainable growth from return on equity. */
    public static final double ASSUMED_PAYOUT_RATIO = 0.4;

    private final boolean enabled;

    public FallbackEstimator(boolean enabled) {
        this.enabled = enabled;
    }

    public RawMetricBag apply(RawMetricBag bag) {
        if (!enabled || bag == null) {
            return bag;
        }
        Map<Metric, Double> estimates = new EnumMap<>(Metric.class);
        if (!bag.has(Metric.SUSTAINABLE_GROWTH_RATE) && bag.has(Metric.RETURN_ON_EQUITY)) {
            estimates.put(Metric.SUSTAINABLE_GROWTH_RATE,
                    bag.get(Metric.RETURN_ON_EQUITY) * (1.0 - ASSUMED_PAYOUT_RATIO));
        }
        return estimates.isEmpty() ? bag : bag.withEstimates(estimates);
    }

    public boolean enabled() {
        return enabled;
    }
}
