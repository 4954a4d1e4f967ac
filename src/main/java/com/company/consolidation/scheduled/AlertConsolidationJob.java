package com.company.consolidation.scheduled;

import com.company.consolidation.config.ConsolidationProperties;
import com.company.consolidation.dto.response.ConsolidationBatchResult;
import com.company.consolidation.service.AlertConsolidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic consolidation run. Fixed delay keeps runs of one instance from
 * overlapping; running several instances over the same window is not
 * guarded against here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "consolidation.schedule.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class AlertConsolidationJob {

    private final AlertConsolidationService consolidationService;
    private final ConsolidationProperties properties;

    @Scheduled(fixedDelayString = "${consolidation.schedule.fixed-delay-ms:300000}", initialDelay = 60000)
    public void consolidateRecentAlerts() {
        ConsolidationProperties.Batch batch = properties.getBatch();

        try {
            ConsolidationBatchResult result =
                    consolidationService.runBatch(batch.getTimeWindowMinutes(), batch.getBatchSize());

            if (result.isEmpty()) {
                log.debug("Scheduled consolidation found no alerts");
                return;
            }

            log.info("Scheduled consolidation: {} alerts, {} groups, {} alerts consolidated",
                    result.getTotal(), result.getGroupsFound(), result.getAlertsConsolidated());

        } catch (Exception e) {
            // next scheduled run picks the remaining alerts up again
            log.error("Scheduled alert consolidation failed", e);
        }
    }
}
