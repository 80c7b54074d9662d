package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Category;
import com.scorebot.model.CategoryScores;
import com.scorebot.model.Metric;
import com.scorebot.model.NormalizationScope;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CategoryScorerTest {

    private final PipelineSettings settings = PipelineSettings.defaults();

    @Test
    void score_shouldRankHigherMomentumAbove() {
        RawMetricBag low = momentumBag("LOW", 1.0, 2.0);
        RawMetricBag mid = momentumBag("MID", 2.0, 4.0);
        RawMetricBag high = momentumBag("HIGH", 3.0, 6.0);
        CategoryScorer scorer = scorerFor(List.of(high, low, mid));

        double lowScore = scorer.scoreCategory(low, Category.MOMENTUM);
        double highScore = scorer.scoreCategory(high, Category.MOMENTUM);

        assertTrue(highScore > 50.0);
        assertTrue(lowScore < 50.0);
        assertEquals(50.0, scorer.scoreCategory(mid, Category.MOMENTUM), 1e-9);
    }

    @Test
    void score_shouldLeaveCategoryOutWhenNoMetricAvailable() {
        RawMetricBag a = momentumBag("AAA", 1.0, 2.0);
        RawMetricBag b = momentumBag("BBB", 2.0, 1.0);
        CategoryScorer scorer = scorerFor(List.of(a, b));

        CategoryScores scores = scorer.score(a);

        assertNotNull(scores.get(Category.MOMENTUM));
        assertNull(scores.get(Category.VALUE));
        assertFalse(scores.asMap().containsKey(Category.SENTIMENT));
        assertEquals(1, scores.compositePresentCount());
    }

    @Test
    void score_shouldIgnoreMetricWithZeroWeight() {
        RawMetricBag a = momentumBag("AAA", 1.0, 30.0);
        RawMetricBag b = momentumBag("BBB", 3.0, 10.0);
        Map<Metric, Double> metricWeights = new EnumMap<>(settings.metricWeights);
        metricWeights.put(Metric.MOMENTUM_6M, 0.0);
        PipelineSettings onlyThreeMonth = settings.toBuilder().metricWeights(metricWeights).build();
        UniverseStatistics statistics = UniverseStatistics.compute(List.of(a, b), MetricNormalizer.from(onlyThreeMonth));
        CategoryScorer scorer = new CategoryScorer(statistics, onlyThreeMonth);

        assertEquals(statistics.percentile(Metric.MOMENTUM_3M, 1.0), scorer.scoreCategory(a, Category.MOMENTUM), 1e-12);
    }

    @Test
    void score_shouldCompareWithinSectorUnderSectorScope() {
        RawMetricBag slowLeader = sectorBag("UTL3", "Utilities", 3.0, 6.0);
        List<RawMetricBag> bags = List.of(
                sectorBag("UTL1", "Utilities", 1.0, 2.0),
                sectorBag("UTL2", "Utilities", 2.0, 4.0),
                slowLeader,
                sectorBag("TEC1", "Technology", 20.0, 40.0),
                sectorBag("TEC2", "Technology", 30.0, 60.0),
                sectorBag("TEC3", "Technology", 40.0, 80.0)
        );
        PipelineSettings sectorSettings = settings.toBuilder().normalizationScope(NormalizationScope.SECTOR).build();
        UniverseStatistics statistics = UniverseStatistics.compute(
                bags, MetricNormalizer.from(sectorSettings), sectorSettings.normalizationScope, sectorSettings.minSectorSize);

        double withinSector = new CategoryScorer(statistics, sectorSettings).scoreCategory(slowLeader, Category.MOMENTUM);
        double acrossUniverse = scorerFor(bags).scoreCategory(slowLeader, Category.MOMENTUM);

        assertTrue(withinSector > 50.0);
        assertTrue(acrossUniverse < 50.0);
    }

    @Test
    void completeness_shouldCountCompositeMetricsOnly() {
        RawMetricBag bag = RawMetricBag.builder(Symbol.of("CMP"))
                .put(Metric.MOMENTUM_3M, 1.0)
                .put(Metric.BETA, 1.2)
                .put(Metric.ANALYST_BULLISH_COUNT, 7.0)
                .build();

        assertEquals(2.0 / Metric.compositeEligible().size(), CategoryScorer.completeness(bag), 1e-12);
    }

    private CategoryScorer scorerFor(List<RawMetricBag> bags) {
        UniverseStatistics statistics = UniverseStatistics.compute(bags, MetricNormalizer.from(settings));
        return new CategoryScorer(statistics, settings);
    }

    private static RawMetricBag sectorBag(String ticker, String sector, double threeMonth, double sixMonth) {
        return RawMetricBag.builder(new Symbol(ticker, sector, Symbol.AssetType.EQUITY))
                .put(Metric.MOMENTUM_3M, threeMonth)
                .put(Metric.MOMENTUM_6M, sixMonth)
                .build();
    }

    private static RawMetricBag momentumBag(String ticker, double threeMonth, double sixMonth) {
        return RawMetricBag.builder(Symbol.of(ticker))
                .put(Metric.MOMENTUM_3M, threeMonth)
                .put(Metric.MOMENTUM_6M, sixMonth)
                .build();
    }
}
