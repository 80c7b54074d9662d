package com.scorebot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path workingDir;

    @Test
    void getters_shouldFallBackToDefaults() {
        Config config = Config.ofOverrides(workingDir, Map.of());

        assertEquals(25, config.getInt("scan.batch_size"));
        assertEquals(0.22, config.getDouble("score.weight.momentum"), 1e-12);
        assertFalse(config.getBoolean("score.allow_fallback_estimates"));
        assertEquals("default", config.sourceOf("scan.batch_size"));
        assertEquals(7, config.getInt("no.such.key", 7));
    }

    @Test
    void overrides_shouldWinOverDefaults() {
        Config config = Config.ofOverrides(workingDir, Map.of(
                "scan.workers", "6",
                "score.allow_fallback_estimates", "yes",
                "fetch.retry.max", "not-a-number"
        ));

        assertEquals(6, config.getInt("scan.workers"));
        assertTrue(config.getBoolean("score.allow_fallback_estimates"));
        assertEquals(3, config.getInt("fetch.retry.max", 3));
        assertEquals("override", config.sourceOf("scan.workers"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Map<String, Object> raw = Map.of(
                "scan", Map.of("workers", 5, "slowdown", Map.of("step_ms", 125)),
                "universe", Map.of("path", "data/universe.csv")
        );

        Config config = Config.fromConfigurationProperties(workingDir, raw);

        assertEquals(5, config.getInt("scan.workers"));
        assertEquals(125L, config.getLong("scan.slowdown.step_ms", 0L));
        assertEquals(workingDir.resolve("data/universe.csv").normalize(), config.getPath("universe.path"));
    }

    @Test
    void getList_shouldSplitOnCommaAndSemicolon() {
        Config config = Config.ofOverrides(workingDir, Map.of("tickers", "AAA, BBB;;CCC"));

        assertEquals(List.of("AAA", "BBB", "CCC"), config.getList("tickers"));
    }

    @Test
    void requireString_shouldFailForMissingKey() {
        Config config = Config.ofOverrides(workingDir, Map.of());

        assertThrows(IllegalArgumentException.class, () -> config.requireString("no.such.key"));
    }
}
