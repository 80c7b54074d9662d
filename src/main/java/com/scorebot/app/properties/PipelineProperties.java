package com.scorebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "scan")
public class PipelineProperties {
    private int workers = 4;
    private int batchSize = 25;
    private Slowdown slowdown = new Slowdown();
    private DeferredRetry deferredRetry = new DeferredRetry();

    @Getter
    @Setter
    public static class Slowdown {
        private int windowBatches = 3;
        private double errorRateThreshold = 0.5;
        private long stepMs = 250L;
        private long maxMs = 5_000L;
    }

    @Getter
    @Setter
    public static class DeferredRetry {
        private boolean enabled = false;
    }
}
