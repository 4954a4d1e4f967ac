package com.company.consolidation.service;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.dto.response.ConsolidationBatchResult;
import com.company.consolidation.dto.response.ConsolidationDetail;
import com.company.consolidation.exception.InvalidBatchRequestException;
import com.company.consolidation.repository.AlertRepository;
import com.company.consolidation.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Batch orchestrator: fetch → group → merge → persist.
 *
 * Groups are persisted one after another. Any storage failure aborts the
 * batch and is rethrown; groups committed before the failure stay
 * committed and their members are no longer fetched by later batches.
 */
@Service
@Slf4j
public class AlertConsolidationService {

    private final AlertRepository alertRepository;
    private final AlertGroupingStrategy groupingStrategy;
    private final AlertConsolidationMerger merger;
    private final ConsolidationPersister persister;
    private final ScoringConfig scoringConfig;
    private final Clock clock;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Timer batchTimer;

    public AlertConsolidationService(
            AlertRepository alertRepository,
            AlertGroupingStrategy groupingStrategy,
            AlertConsolidationMerger merger,
            ConsolidationPersister persister,
            ScoringConfig scoringConfig,
            Clock clock,
            Tracer tracer,
            MeterRegistry meterRegistry) {
        this.alertRepository = alertRepository;
        this.groupingStrategy = groupingStrategy;
        this.merger = merger;
        this.persister = persister;
        this.scoringConfig = scoringConfig;
        this.clock = clock;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.batchTimer = Timer.builder("consolidation.batch.duration")
                .description("Duration of one alert consolidation batch")
                .register(meterRegistry);
    }

    /**
     * Consolidate the un-consolidated alerts created in the last
     * {@code timeWindowMinutes}, reading at most {@code limit} of them.
     */
    public ConsolidationBatchResult runBatch(int timeWindowMinutes, int limit) {
        if (timeWindowMinutes <= 0) {
            throw new InvalidBatchRequestException("timeWindowMinutes must be positive: " + timeWindowMinutes);
        }
        if (limit <= 0) {
            throw new InvalidBatchRequestException("batchSize must be positive: " + limit);
        }

        Span span = tracer.spanBuilder("alert.consolidation.batch")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("batch.time_window_minutes", timeWindowMinutes);
            span.setAttribute("batch.limit", limit);
            span.setAttribute("batch.grouping_strategy", groupingStrategy.name());

            ConsolidationBatchResult result = batchTimer.record(() -> doRunBatch(timeWindowMinutes, limit));

            span.setAttribute("batch.total", result.getTotal());
            span.setAttribute("batch.groups", result.getGroupsFound());
            span.setAttribute("batch.created", result.getConsolidatedAlertsCreated());

            meterRegistry.counter("consolidation.batches.completed").increment();
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Alert consolidation batch failed");
            meterRegistry.counter("consolidation.batches.failed").increment();
            log.error("Alert consolidation batch failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    private ConsolidationBatchResult doRunBatch(int timeWindowMinutes, int limit) {
        long startedAt = System.currentTimeMillis();
        Instant since = TimeUtils.windowStart(clock.instant(), timeWindowMinutes);

        log.info("Starting alert consolidation: window={}min, limit={}, strategy={}",
                timeWindowMinutes, limit, groupingStrategy.name());

        List<Alert> alerts = alertRepository.fetchUnconsolidated(since, limit);
        log.info("Retrieved {} alerts for consolidation processing", alerts.size());

        if (alerts.isEmpty()) {
            log.debug("No alerts to consolidate");
            return ConsolidationBatchResult.empty();
        }

        List<List<Alert>> groups = groupingStrategy.group(alerts, scoringConfig);

        ConsolidationBatchResult result = ConsolidationBatchResult.builder()
                .total(alerts.size())
                .groupsFound(groups.size())
                .build();

        meterRegistry.counter("consolidation.groups.found").increment(groups.size());

        for (List<Alert> group : groups) {
            List<String> memberIds = group.stream().map(Alert::getId).toList();

            Alert consolidated = merger.consolidate(group);
            Alert created = persister.persistGroup(consolidated, memberIds);

            result.setAlertsConsolidated(result.getAlertsConsolidated() + group.size());
            result.setConsolidatedAlertsCreated(result.getConsolidatedAlertsCreated() + 1);
            result.getDetails().add(ConsolidationDetail.builder()
                    .consolidatedAlertId(created.getId())
                    .originalAlertCount(group.size())
                    .originalAlertIds(memberIds)
                    .build());

            meterRegistry.counter("consolidation.alerts.consolidated").increment(group.size());
        }

        log.info("Alert consolidation completed in {}: {} alerts, {} groups, {} consolidated alerts created",
                TimeUtils.formatDuration(System.currentTimeMillis() - startedAt),
                result.getTotal(), result.getGroupsFound(), result.getConsolidatedAlertsCreated());

        return result;
    }
}
