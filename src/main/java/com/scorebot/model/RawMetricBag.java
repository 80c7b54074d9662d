package com.scorebot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-symbol bag of raw metric values. Absent and non-finite values are both absent.
 */
public final class RawMetricBag {
    private final Symbol symbol;
    private final Map<Metric, Double> values;
    private final Set<Metric> estimated;

    private RawMetricBag(Symbol symbol, Map<Metric, Double> values, Set<Metric> estimated) {
        this.symbol = symbol;
        this.values = Collections.unmodifiableMap(values);
        this.estimated = Collections.unmodifiableSet(estimated);
    }

    public static Builder builder(Symbol symbol) {
        return new Builder(symbol);
    }

    public static RawMetricBag empty(Symbol symbol) {
        return new Builder(symbol).build();
    }

    public Symbol symbol() {
        return symbol;
    }

    /**
     * @return the value, or null when the provider had no data for the metric
     */
    public Double get(Metric metric) {
        return values.get(metric);
    }

    public boolean has(Metric metric) {
        return values.containsKey(metric);
    }

    public boolean isEstimated(Metric metric) {
        return estimated.contains(metric);
    }

    public Set<Metric> estimatedMetrics() {
        return estimated;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Raw inputs keyed by provider field name, in declaration order, for the audit column.
     */
    public Map<String, Double> asKeyedMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            out.put(metric.key(), values.get(metric));
        }
        return out;
    }

    /**
     * Copy with the given metrics replaced by estimates. Existing real values are never overwritten.
     */
    public RawMetricBag withEstimates(Map<Metric, Double> estimates) {
        Builder builder = toBuilder();
        for (Map.Entry<Metric, Double> entry : estimates.entrySet()) {
            if (has(entry.getKey())) {
                continue;
            }
            builder.estimate(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(symbol);
        builder.values.putAll(values);
        builder.estimated.addAll(estimated);
        return builder;
    }

    public static final class Builder {
        private final Symbol symbol;
        private final EnumMap<Metric, Double> values = new EnumMap<>(Metric.class);
        private final EnumSet<Metric> estimated = EnumSet.noneOf(Metric.class);

        private Builder(Symbol symbol) {
            if (symbol == null) {
                throw new IllegalArgumentException("symbol must not be null");
            }
            this.symbol = symbol;
        }

        public Builder put(Metric metric, Double value) {
            if (metric == null) {
                return this;
            }
            if (value == null || !Double.isFinite(value)) {
                values.remove(metric);
                estimated.remove(metric);
                return this;
            }
            values.put(metric, value);
            estimated.remove(metric);
            return this;
        }

        public Builder estimate(Metric metric, Double value) {
            if (metric == null || value == null || !Double.isFinite(value)) {
                return this;
            }
            values.put(metric, value);
            estimated.add(metric);
            return this;
        }

        public RawMetricBag build() {
            return new RawMetricBag(symbol, new EnumMap<>(values), estimated.isEmpty()
                    ? EnumSet.noneOf(Metric.class)
                    : EnumSet.copyOf(estimated));
        }
    }
}
