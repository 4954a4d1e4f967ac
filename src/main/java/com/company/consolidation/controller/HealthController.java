package com.company.consolidation.controller;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.service.AlertGroupingStrategy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final AlertGroupingStrategy groupingStrategy;
    private final ScoringConfig scoringConfig;

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "alert-consolidation-service");
        response.put("groupingStrategy", groupingStrategy.name());
        response.put("relationThreshold", scoringConfig.getRelationThreshold());

        return ResponseEntity.ok(response);
    }
}
