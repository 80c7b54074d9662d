package com.scorebot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Blended score plus the weights actually applied after dropping missing categories.
 */
public final class CompositeScore {
    private final Double value;
    private final Map<Category, Double> appliedWeights;
    private final int categoriesPresent;

    private CompositeScore(Double value, Map<Category, Double> appliedWeights, int categoriesPresent) {
        this.value = value;
        this.appliedWeights = appliedWeights == null || appliedWeights.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(appliedWeights));
        this.categoriesPresent = Math.max(0, categoriesPresent);
    }

    public static CompositeScore of(double value, Map<Category, Double> appliedWeights) {
        return new CompositeScore(value, appliedWeights, appliedWeights.size());
    }

    public static CompositeScore insufficient(int categoriesPresent) {
        return new CompositeScore(null, Map.of(), categoriesPresent);
    }

    /**
     * @return the composite, or null when too few categories were present
     */
    public Double value() {
        return value;
    }

    public boolean isPresent() {
        return value != null;
    }

    public Map<Category, Double> appliedWeights() {
        return appliedWeights;
    }

    public int categoriesPresent() {
        return categoriesPresent;
    }

    public double appliedWeightSum() {
        double sum = 0.0;
        for (double weight : appliedWeights.values()) {
            sum += weight;
        }
        return sum;
    }
}
