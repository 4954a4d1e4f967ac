package com.company.consolidation.config;

import com.company.consolidation.repository.AlertRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Consolidation backlog metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertRepository alertRepository;

    @Bean
    public MeterBinder consolidationMetrics() {
        return (registry) -> {
            Gauge.builder("consolidation.alerts.pending", alertRepository, repo -> {
                        try {
                            return repo.countUnconsolidated();
                        } catch (Exception e) {
                            log.warn("Failed to count unconsolidated alerts", e);
                            return 0;
                        }
                    })
                    .description("Number of alerts not yet considered for consolidation")
                    .register(registry);

            log.info("Consolidation metrics registered");
        };
    }
}
