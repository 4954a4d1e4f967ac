package com.company.consolidation.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsolidationResponse {

    public static final String COMPLETED = "Alert consolidation completed";
    public static final String NOTHING_TO_CONSOLIDATE = "No alerts to consolidate";
    public static final String FAILED = "Error in alert consolidation process";

    private String message;
    private ConsolidationBatchResult results;
    private String error;

    public static ConsolidationResponse of(ConsolidationBatchResult results) {
        return new ConsolidationResponse(
                results.isEmpty() ? NOTHING_TO_CONSOLIDATE : COMPLETED, results, null);
    }

    public static ConsolidationResponse failure(String error) {
        return new ConsolidationResponse(FAILED, null, error);
    }
}
