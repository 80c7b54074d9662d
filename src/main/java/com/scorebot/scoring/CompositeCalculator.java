package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Category;
import com.scorebot.model.CategoryScores;
import com.scorebot.model.CompositeScore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Blends category scores into one composite. Missing categories are dropped and the remaining
 * base weights re-normalized to 1. Sentiment never takes part.
 */
public final class CompositeCalculator {
    private static final Logger LOG = LogManager.getLogger(CompositeCalculator.class);

    private final int minCategories;

    public CompositeCalculator(int minCategories) {
        if (minCategories < 1) {
            throw new IllegalArgumentException("minCategories must be >= 1");
        }
        this.minCategories = minCategories;
    }

    public static CompositeCalculator from(PipelineSettings settings) {
        return new CompositeCalculator(settings.minCategories);
    }

    public CompositeScore combine(CategoryScores scores, Map<Category, Double> baseWeights) {
        return combine(scores == null ? Map.of() : scores.asMap(), baseWeights);
    }

    /**
     * @throws ScoreValidationException when an input score or the result is NaN or infinite
     */
    public CompositeScore combine(Map<Category, Double> scores, Map<Category, Double> baseWeights) {
        Map<Category, Double> present = new EnumMap<>(Category.class);
        double presentWeight = 0.0;
        for (Map.Entry<Category, Double> entry : scores.entrySet()) {
            Category category = entry.getKey();
            Double score = entry.getValue();
            if (category == null || score == null || !category.compositeEligible()) {
                continue;
            }
            if (!Double.isFinite(score)) {
                throw new ScoreValidationException("non-finite " + category.label() + " score: " + score);
            }
            Double weight = baseWeights.get(category);
            if (weight == null || weight <= 0.0) {
                continue;
            }
            present.put(category, score);
            presentWeight += weight;
        }
        if (present.size() < minCategories || presentWeight <= 0.0) {
            return CompositeScore.insufficient(present.size());
        }

        Map<Category, Double> applied = new EnumMap<>(Category.class);
        double composite = 0.0;
        for (Map.Entry<Category, Double> entry : present.entrySet()) {
            double weight = baseWeights.get(entry.getKey()) / presentWeight;
            applied.put(entry.getKey(), weight);
            composite += entry.getValue() * weight;
        }
        if (!Double.isFinite(composite)) {
            throw new ScoreValidationException("non-finite composite: " + composite);
        }
        double clamped = Math.max(0.0, Math.min(100.0, composite));
        if (clamped != composite) {
            LOG.warn("Composite clamped from {} to {}; category scores out of range: {}", composite, clamped, present);
        }
        return CompositeScore.of(clamped, applied);
    }

    public int minCategories() {
        return minCategories;
    }
}
