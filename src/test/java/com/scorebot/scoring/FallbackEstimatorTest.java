package com.scorebot.scoring;

import com.scorebot.model.Metric;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FallbackEstimatorTest {

    @Test
    void apply_shouldDeriveSustainableGrowthFromReturnOnEquity() {
        RawMetricBag bag = RawMetricBag.builder(Symbol.of("ROE"))
                .put(Metric.RETURN_ON_EQUITY, 20.0)
                .build();

        RawMetricBag estimated = new FallbackEstimator(true).apply(bag);

        assertEquals(12.0, estimated.get(Metric.SUSTAINABLE_GROWTH_RATE), 1e-9);
        assertTrue(estimated.isEstimated(Metric.SUSTAINABLE_GROWTH_RATE));
        assertFalse(estimated.isEstimated(Metric.RETURN_ON_EQUITY));
    }

    @Test
    void apply_shouldNotOverwriteRealValue() {
        RawMetricBag bag = RawMetricBag.builder(Symbol.of("REAL"))
                .put(Metric.RETURN_ON_EQUITY, 20.0)
                .put(Metric.SUSTAINABLE_GROWTH_RATE, 3.0)
                .build();

        RawMetricBag out = new FallbackEstimator(true).apply(bag);

        assertSame(bag, out);
        assertEquals(3.0, out.get(Metric.SUSTAINABLE_GROWTH_RATE), 1e-12);
    }

    @Test
    void apply_shouldLeaveBagUntouchedWhenDisabled() {
        RawMetricBag bag = RawMetricBag.builder(Symbol.of("OFF"))
                .put(Metric.RETURN_ON_EQUITY, 20.0)
                .build();

        RawMetricBag out = new FallbackEstimator(false).apply(bag);

        assertSame(bag, out);
        assertNull(out.get(Metric.SUSTAINABLE_GROWTH_RATE));
    }
}
