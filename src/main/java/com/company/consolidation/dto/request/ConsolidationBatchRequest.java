package com.company.consolidation.dto.request;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trigger for one consolidation batch; null fields fall back to the
 * configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationBatchRequest {

    @Positive(message = "timeWindowMinutes must be positive")
    private Integer timeWindowMinutes;

    @Positive(message = "batchSize must be positive")
    private Integer batchSize;
}
