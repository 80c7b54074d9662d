package com.scorebot.scoring;

import com.scorebot.config.PipelineSettings;
import com.scorebot.model.Metric;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricNormalizerTest {

    private final MetricNormalizer normalizer = MetricNormalizer.from(PipelineSettings.defaults());

    @Test
    void normalize_shouldKeepNullsAligned() {
        List<Double> out = normalizer.normalize(Metric.MOMENTUM_3M, Arrays.asList(1.0, null, 3.0, 2.0));

        assertEquals(4, out.size());
        assertNotNull(out.get(0));
        assertNull(out.get(1));
        assertTrue(out.get(2) > out.get(3));
        assertTrue(out.get(3) > out.get(0));
    }

    @Test
    void normalize_shouldFavorLowValuesForLowerIsBetterMetric() {
        List<Double> out = normalizer.normalize(Metric.TRAILING_PE, List.of(10.0, 20.0, 30.0));

        assertTrue(out.get(0) > out.get(1));
        assertTrue(out.get(1) > out.get(2));
        assertEquals(50.0, out.get(1), 1e-9);
    }

    @Test
    void normalize_shouldReturnNullsWhenOnlyOneValuePresent() {
        List<Double> out = normalizer.normalize(Metric.BETA, Arrays.asList(null, 1.1, null));

        assertEquals(Arrays.asList(null, null, null), out);
    }

    @Test
    void normalize_shouldStayInRangeForEveryInput() {
        List<Double> raw = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            raw.add(i % 5 == 0 ? 0.0 : Math.pow(-1, i) * i * 13.7);
        }
        raw.add(9.9e15);
        for (Double score : normalizer.normalize(Metric.FCF_GROWTH_YOY, raw)) {
            assertTrue(score >= 0.0 && score <= 100.0, "score out of range: " + score);
        }
    }

    @Test
    void constructor_shouldRejectInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new MetricNormalizer(99, 1, 3));
        assertThrows(IllegalArgumentException.class, () -> new MetricNormalizer(1, 99, 0));
    }
}
