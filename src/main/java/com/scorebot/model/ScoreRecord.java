package com.scorebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One persisted row of the score table, keyed by (symbol, asOfDate).
 * Null scores mean "data not available", never "neutral".
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoreRecord {
    public final String symbol;
    public final LocalDate asOfDate;
    public final Double compositeScore;
    public final Double compositePercentileRank;
    public final CategoryScores categoryScores;
    public final Double sentimentScore;
    public final Map<Category, Double> appliedWeights;
    public final Map<String, Double> metricInputs;
    public final List<String> estimatedMetrics;
    public final double completenessRatio;
}
