package com.scorebot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category 0-100 scores for one symbol. A category missing from the map has no score.
 */
public final class CategoryScores {
    private final Map<Category, Double> scores;

    public CategoryScores(Map<Category, Double> scores) {
        EnumMap<Category, Double> copy = new EnumMap<>(Category.class);
        if (scores != null) {
            for (Map.Entry<Category, Double> entry : scores.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.scores = Collections.unmodifiableMap(copy);
    }

    public Double get(Category category) {
        return scores.get(category);
    }

    public Map<Category, Double> asMap() {
        return scores;
    }

    public int compositePresentCount() {
        int n = 0;
        for (Category category : scores.keySet()) {
            if (category.compositeEligible()) {
                n++;
            }
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CategoryScores other && scores.equals(other.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return scores.toString();
    }
}
