package com.company.consolidation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bound from the {@code consolidation.*} keys of application.yml
 */
@Data
@ConfigurationProperties(prefix = "consolidation")
public class ConsolidationProperties {

    private Scoring scoring = new Scoring();
    private Grouping grouping = new Grouping();
    private Batch batch = new Batch();
    private Schedule schedule = new Schedule();

    @Data
    public static class Scoring {
        private Weights weights = new Weights();
        private double relationThreshold = ScoringConfig.DEFAULT_RELATION_THRESHOLD;
        private double duplicateThreshold = ScoringConfig.DEFAULT_DUPLICATE_THRESHOLD;
        private double locationDecayKm = ScoringConfig.DEFAULT_LOCATION_DECAY_KM;
    }

    @Data
    public static class Weights {
        private double headline = 0.25;
        private double description = 0.25;
        private double location = 0.30;
        private double eventType = 0.10;
        private double timeOverlap = 0.10;
    }

    @Data
    public static class Grouping {
        // greedy-seed or transitive
        private String strategy = "greedy-seed";
    }

    @Data
    public static class Batch {
        private int timeWindowMinutes = 60;
        private int batchSize = 100;
        private int writeChunkSize = 25;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private long fixedDelayMs = 300000;
    }
}
