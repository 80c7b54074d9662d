package com.scorebot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;

public interface ScoreMapper {
    @Insert("INSERT INTO stock_scores(symbol, as_of_date, composite_score, composite_percentile_rank, " +
            "momentum_score, value_score, quality_score, growth_score, stability_score, positioning_score, " +
            "sentiment_score, completeness_ratio, applied_weights, metric_inputs, estimated_metrics, updated_at) " +
            "VALUES(#{symbol}, #{asOfDate}, #{compositeScore,jdbcType=DOUBLE}, #{compositePercentileRank,jdbcType=DOUBLE}, " +
            "#{momentumScore,jdbcType=DOUBLE}, #{valueScore,jdbcType=DOUBLE}, #{qualityScore,jdbcType=DOUBLE}, " +
            "#{growthScore,jdbcType=DOUBLE}, #{stabilityScore,jdbcType=DOUBLE}, #{positioningScore,jdbcType=DOUBLE}, " +
            "#{sentimentScore,jdbcType=DOUBLE}, #{completenessRatio}, " +
            "CAST(#{appliedWeightsJson} AS JSONB), CAST(#{metricInputsJson} AS JSONB), " +
            "CAST(#{estimatedMetricsJson} AS JSONB), #{updatedAt}) " +
            "ON CONFLICT(symbol, as_of_date) DO UPDATE SET " +
            "composite_score=excluded.composite_score, " +
            "composite_percentile_rank=excluded.composite_percentile_rank, " +
            "momentum_score=excluded.momentum_score, value_score=excluded.value_score, " +
            "quality_score=excluded.quality_score, growth_score=excluded.growth_score, " +
            "stability_score=excluded.stability_score, positioning_score=excluded.positioning_score, " +
            "sentiment_score=excluded.sentiment_score, completeness_ratio=excluded.completeness_ratio, " +
            "applied_weights=excluded.applied_weights, metric_inputs=excluded.metric_inputs, " +
            "estimated_metrics=excluded.estimated_metrics, updated_at=excluded.updated_at")
    int upsert(ScoreUpsertParam row);

    @Select("SELECT COUNT(*) FROM stock_scores WHERE as_of_date=#{asOfDate}")
    int countForDate(@Param("asOfDate") LocalDate asOfDate);
}
