package com.scorebot.app;

import com.scorebot.app.properties.DbProperties;
import com.scorebot.app.properties.PipelineProperties;
import com.scorebot.config.Config;
import com.scorebot.config.PipelineSettings;
import com.scorebot.db.Database;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBotBootstrapConfigTest {

    @Test
    void pipelineSettings_shouldPreferScanProperties() {
        Config config = Config.ofOverrides(Path.of("."), Map.of("fetch.retry.max", "5"));
        PipelineProperties properties = new PipelineProperties();
        properties.setWorkers(2);
        properties.setBatchSize(10);
        properties.getSlowdown().setWindowBatches(4);
        properties.getSlowdown().setStepMs(100);
        properties.getDeferredRetry().setEnabled(true);

        PipelineSettings settings = new ScoreBotBootstrapConfig().pipelineSettings(config, properties);

        assertEquals(2, settings.workers);
        assertEquals(10, settings.batchSize);
        assertEquals(4, settings.slowdownWindowBatches);
        assertEquals(100L, settings.slowdownStepMs);
        assertTrue(settings.deferredRetryEnabled);
        assertEquals(5, settings.maxRetries);
    }

    @Test
    void pipelineSettings_shouldValidateOverrides() {
        PipelineProperties properties = new PipelineProperties();
        properties.setBatchSize(0);

        assertThrows(IllegalArgumentException.class,
                () -> new ScoreBotBootstrapConfig().pipelineSettings(Config.ofOverrides(Path.of("."), Map.of()), properties));
    }

    @Test
    void buildDatabase_shouldUseBoundProperties() {
        Assumptions.assumeTrue(System.getenv("SCOREBOT_DB_URL") == null);
        DbProperties properties = new DbProperties();
        properties.setUrl("jdbc:postgresql://db.local:5432/scores?password=secret");
        properties.setSchema("factor_scores");

        Database database = ScoreBotBootstrapConfig.buildDatabase(properties);

        assertEquals("factor_scores", database.schema());
        assertFalse(database.maskedJdbcUrl().contains("secret"));
    }
}
