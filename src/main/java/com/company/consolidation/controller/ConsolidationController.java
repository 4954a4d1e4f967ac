package com.company.consolidation.controller;

import com.company.consolidation.config.ConsolidationProperties;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.dto.request.ConsolidationBatchRequest;
import com.company.consolidation.dto.response.ConsolidationBatchResult;
import com.company.consolidation.dto.response.ConsolidationResponse;
import com.company.consolidation.exception.AlertNotFoundException;
import com.company.consolidation.repository.AlertRepository;
import com.company.consolidation.service.AlertConsolidationService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/consolidation")
@Tag(name = "Alert Consolidation", description = "Trigger consolidation batches and inspect consolidated alerts")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ConsolidationController {

    private final AlertConsolidationService consolidationService;
    private final AlertRepository alertRepository;
    private final ConsolidationProperties properties;
    private final MeterRegistry meterRegistry;

    @PostMapping("/batches")
    @Operation(summary = "Run a consolidation batch",
            description = "Groups recent un-consolidated alerts and merges each group into one primary alert")
    public ResponseEntity<ConsolidationResponse> runBatch(
            @Valid @RequestBody(required = false) ConsolidationBatchRequest request) {

        ConsolidationProperties.Batch defaults = properties.getBatch();
        int timeWindowMinutes = request != null && request.getTimeWindowMinutes() != null
                ? request.getTimeWindowMinutes() : defaults.getTimeWindowMinutes();
        int batchSize = request != null && request.getBatchSize() != null
                ? request.getBatchSize() : defaults.getBatchSize();

        log.info("Consolidation batch requested: window={}min, batchSize={}", timeWindowMinutes, batchSize);

        meterRegistry.counter("api.consolidation.batch.requests").increment();

        ConsolidationBatchResult results = consolidationService.runBatch(timeWindowMinutes, batchSize);

        return ResponseEntity.ok(ConsolidationResponse.of(results));
    }

    @GetMapping("/alerts/{alertId}")
    @Operation(summary = "Get an alert", description = "Returns a source or consolidated alert by id")
    public ResponseEntity<Alert> getAlert(@PathVariable String alertId) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
        return ResponseEntity.ok(alert);
    }
}
