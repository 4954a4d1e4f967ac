package com.company.consolidation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Classification attached to an alert by the (external) classifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiClassification implements Serializable {
    private static final long serialVersionUID = 1L;

    private String primaryCategory;
    private String specificType;
    private Integer severityLevel;
    private Double confidenceScore;

    public int severityOrZero() {
        return severityLevel != null ? severityLevel : 0;
    }
}
