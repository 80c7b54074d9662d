package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Category;
import com.scorebot.model.ScoreRecord;

import java.util.Map;

/**
 * Last check before a record is written: every score finite and within [0,100], weights summing to 1.
 */
public final class ScoreValidator {

    private ScoreValidator() {
    }

    public static void validate(ScoreRecord record) {
        String symbol = record.symbol;
        if (record.categoryScores != null) {
            for (Map.Entry<Category, Double> entry : record.categoryScores.asMap().entrySet()) {
                checkScore(symbol, entry.getKey().label(), entry.getValue());
            }
        }
        checkScore(symbol, "sentiment", record.sentimentScore);
        checkScore(symbol, "composite", record.compositeScore);
        checkScore(symbol, "composite_percentile_rank", record.compositePercentileRank);
        if (!Double.isFinite(record.completenessRatio)
                || record.completenessRatio < 0.0
                || record.completenessRatio > 1.0) {
            throw new ScoreValidationException(symbol, "completeness ratio out of range: " + record.completenessRatio);
        }
        if (record.compositeScore != null) {
            double sum = 0.0;
            if (record.appliedWeights != null) {
                for (Double weight : record.appliedWeights.values()) {
                    sum += weight == null ? Double.NaN : weight;
                }
            }
            if (!(Math.abs(sum - 1.0) <= PipelineSettings.WEIGHT_TOLERANCE)) {
                throw new ScoreValidationException(symbol, "applied weights sum to " + sum);
            }
        }
    }

    private static void checkScore(String symbol, String name, Double value) {
        if (value == null) {
            return;
        }
        if (!Double.isFinite(value)) {
            throw new ScoreValidationException(symbol, "non-finite " + name + " score: " + value);
        }
        if (value < 0.0 || value > 100.0) {
            throw new ScoreValidationException(symbol, name + " score out of range: " + value);
        }
    }
}
