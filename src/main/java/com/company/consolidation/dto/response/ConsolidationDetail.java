package com.company.consolidation.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationDetail {
    private String consolidatedAlertId;
    private int originalAlertCount;
    private List<String> originalAlertIds;
}
