package com.scorebot.app;

import com.scorebot.app.properties.DbProperties;
import com.scorebot.app.properties.PipelineProperties;
import com.scorebot.config.Config;
import com.scorebot.config.PipelineSettings;
import com.scorebot.data.HttpMetricSource;
import com.scorebot.data.MetricSource;
import com.scorebot.db.Database;
import com.scorebot.db.MigrationRunner;
import com.scorebot.db.ScoreRecordDao;
import com.scorebot.db.UniverseDao;
import com.scorebot.runner.ScoringPipeline;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, PipelineProperties.class})
public class ScoreBotBootstrapConfig {
    @Bean
    public Config scoreBotConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    /**
     * Typed settings from {@code Config}; the {@code scan.*} properties bean wins for the scheduler options.
     */
    @Bean
    public PipelineSettings pipelineSettings(Config config, PipelineProperties pipelineProperties) {
        PipelineSettings base = PipelineSettings.from(config);
        if (pipelineProperties == null) {
            return base;
        }
        PipelineProperties.Slowdown slowdown = pipelineProperties.getSlowdown() == null
                ? new PipelineProperties.Slowdown()
                : pipelineProperties.getSlowdown();
        boolean deferred = pipelineProperties.getDeferredRetry() != null
                && pipelineProperties.getDeferredRetry().isEnabled();
        return base.toBuilder()
                .workers(pipelineProperties.getWorkers())
                .batchSize(pipelineProperties.getBatchSize())
                .slowdownWindowBatches(slowdown.getWindowBatches())
                .slowdownErrorRateThreshold(slowdown.getErrorRateThreshold())
                .slowdownStepMs(slowdown.getStepMs())
                .slowdownMaxMs(slowdown.getMaxMs())
                .deferredRetryEnabled(deferred)
                .build()
                .validate();
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = buildDatabase(dbProperties);
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public UniverseDao universeDao(Database database) {
        return new UniverseDao(database);
    }

    @Bean
    @Lazy
    public ScoreRecordDao scoreRecordDao(Database database) {
        return new ScoreRecordDao(database);
    }

    @Bean
    public MetricSource metricSource(Config config) {
        return new HttpMetricSource(config);
    }

    @Bean
    @Lazy
    public ScoringPipeline scoringPipeline(PipelineSettings settings, MetricSource metricSource, ScoreRecordDao scoreRecordDao) {
        return new ScoringPipeline(settings, metricSource, scoreRecordDao);
    }

    static Database buildDatabase(DbProperties dbProperties) {
        return new Database(
                firstNonBlank(System.getenv("SCOREBOT_DB_URL"),
                        dbProperties == null ? null : dbProperties.getUrl(),
                        "jdbc:postgresql://localhost:5432/scorebot"),
                firstNonBlank(System.getenv("SCOREBOT_DB_USER"),
                        dbProperties == null ? null : dbProperties.getUser(),
                        "scorebot"),
                firstNonBlank(System.getenv("SCOREBOT_DB_PASS"),
                        dbProperties == null ? null : dbProperties.getPass(),
                        "scorebot"),
                firstNonBlank(dbProperties == null ? null : dbProperties.getSchema(), "scorebot"),
                dbProperties != null && dbProperties.getSqlLog() != null && dbProperties.getSqlLog().isEnabled()
        );
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
