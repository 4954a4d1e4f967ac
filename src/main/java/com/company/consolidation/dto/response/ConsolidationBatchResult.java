package com.company.consolidation.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics of one consolidation batch
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsolidationBatchResult {
    private int total;
    private int groupsFound;
    private int alertsConsolidated;
    private int consolidatedAlertsCreated;

    @Builder.Default
    private List<ConsolidationDetail> details = new ArrayList<>();

    /**
     * Result of a batch that fetched nothing: zero counters, no details.
     */
    public static ConsolidationBatchResult empty() {
        return ConsolidationBatchResult.builder().details(null).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return total == 0;
    }
}
