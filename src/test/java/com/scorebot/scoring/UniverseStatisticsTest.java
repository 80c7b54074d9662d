package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Metric;
import com.scorebot.model.NormalizationScope;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniverseStatisticsTest {

    @Test
    void compute_shouldFitOrientedValuesPerMetric() {
        List<RawMetricBag> bags = List.of(
                bag("AAA", 10.0),
                bag("BBB", 20.0),
                bag("CCC", 30.0),
                RawMetricBag.builder(Symbol.of("DDD")).put(Metric.BETA, 1.0).build()
        );

        UniverseStatistics statistics = UniverseStatistics.compute(bags, MetricNormalizer.from(PipelineSettings.defaults()));

        assertEquals(4, statistics.universeSize());
        assertEquals(3, statistics.distribution(Metric.TRAILING_PE).count());
        assertTrue(statistics.distribution(Metric.TRAILING_PE).mean() < 0.0);
        assertTrue(statistics.percentile(Metric.TRAILING_PE, 10.0) > statistics.percentile(Metric.TRAILING_PE, 30.0));
        assertTrue(statistics.distribution(Metric.BETA).degenerate());
        assertNull(statistics.percentile(Metric.BETA, 1.0));
        assertNull(statistics.percentile(Metric.TRAILING_PE, null));
    }

    @Test
    void compute_shouldScoreAgainstSectorPeersWhenScopeIsSector() {
        List<RawMetricBag> bags = List.of(
                roe("BNK1", "Banks", 5.0),
                roe("BNK2", "Banks", 6.0),
                roe("BNK3", "banks", 7.0),
                roe("SFT1", "Software", 30.0),
                roe("SFT2", "Software", 40.0),
                roe("SFT3", "Software", 50.0),
                roe("UTL1", "Utilities", 9.0),
                roe("NOSEC", "", 20.0)
        );
        MetricNormalizer normalizer = MetricNormalizer.from(PipelineSettings.defaults());

        UniverseStatistics sector = UniverseStatistics.compute(bags, normalizer, NormalizationScope.SECTOR, 3);
        UniverseStatistics universe = UniverseStatistics.compute(bags, normalizer);

        assertEquals(3, sector.sectorCount());
        assertEquals(50.0, sector.percentile("Banks", Metric.RETURN_ON_EQUITY, 6.0), 1e-9);
        assertEquals(50.0, sector.percentile("Software", Metric.RETURN_ON_EQUITY, 40.0), 1e-9);
        assertTrue(sector.percentile("Banks", Metric.RETURN_ON_EQUITY, 7.0) > 50.0);
        assertTrue(universe.percentile("Banks", Metric.RETURN_ON_EQUITY, 7.0) < 50.0);
        assertNull(sector.percentile("Utilities", Metric.RETURN_ON_EQUITY, 9.0));
        assertNull(sector.sectorDistribution("Utilities", Metric.RETURN_ON_EQUITY));
        assertEquals(universe.percentile(Metric.RETURN_ON_EQUITY, 20.0),
                sector.percentile("", Metric.RETURN_ON_EQUITY, 20.0));
        assertEquals(8, sector.distribution(Metric.RETURN_ON_EQUITY).count());
    }

    @Test
    void compute_shouldIgnoreSectorsUnderUniverseScope() {
        List<RawMetricBag> bags = List.of(
                roe("AAA", "Banks", 5.0),
                roe("BBB", "Banks", 6.0),
                roe("CCC", "Software", 30.0)
        );

        UniverseStatistics statistics = UniverseStatistics.compute(bags, MetricNormalizer.from(PipelineSettings.defaults()));

        assertEquals(NormalizationScope.UNIVERSE, statistics.scope());
        assertEquals(0, statistics.sectorCount());
        assertEquals(statistics.percentile(Metric.RETURN_ON_EQUITY, 6.0),
                statistics.percentile("Banks", Metric.RETURN_ON_EQUITY, 6.0));
    }

    private static RawMetricBag roe(String ticker, String sector, double value) {
        return RawMetricBag.builder(new Symbol(ticker, sector, Symbol.AssetType.EQUITY)).put(Metric.RETURN_ON_EQUITY, value).build();
    }

    private static RawMetricBag bag(String ticker, double pe) {
        return RawMetricBag.builder(Symbol.of(ticker)).put(Metric.TRAILING_PE, pe).build();
    }
}
