package com.company.consolidation.config;

import com.company.consolidation.service.AlertGroupingStrategy;
import com.company.consolidation.service.AlertSimilarityScorer;
import com.company.consolidation.service.GreedySeedClustering;
import com.company.consolidation.service.TransitiveClustering;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the scoring configuration and the grouping strategy selected by
 * {@code consolidation.grouping.strategy}.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(ConsolidationProperties.class)
public class ConsolidationConfig {

    @Bean
    public ScoringConfig scoringConfig(ConsolidationProperties properties) {
        ScoringConfig config = ScoringConfig.from(properties.getScoring());
        log.info("Alert scoring configured: {}", config);
        return config;
    }

    @Bean
    public AlertGroupingStrategy alertGroupingStrategy(ConsolidationProperties properties,
                                                       AlertSimilarityScorer scorer) {
        return groupingStrategy(properties.getGrouping().getStrategy(), scorer);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static AlertGroupingStrategy groupingStrategy(String name, AlertSimilarityScorer scorer) {
        if (name == null || GreedySeedClustering.NAME.equalsIgnoreCase(name.trim())) {
            return new GreedySeedClustering(scorer);
        }
        if (TransitiveClustering.NAME.equalsIgnoreCase(name.trim())) {
            return new TransitiveClustering(scorer);
        }
        throw new IllegalArgumentException("Unknown grouping strategy: " + name
                + " (expected " + GreedySeedClustering.NAME + " or " + TransitiveClustering.NAME + ")");
    }
}
