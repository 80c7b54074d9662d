package com.scorebot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreUpsertParam {
    private String symbol;
    private LocalDate asOfDate;
    private Double compositeScore;
    private Double compositePercentileRank;
    private Double momentumScore;
    private Double valueScore;
    private Double qualityScore;
    private Double growthScore;
    private Double stabilityScore;
    private Double positioningScore;
    private Double sentimentScore;
    private double completenessRatio;
    private String appliedWeightsJson;
    private String metricInputsJson;
    private String estimatedMetricsJson;
    private OffsetDateTime updatedAt;
}
