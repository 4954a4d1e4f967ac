package com.company.consolidation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Provenance summary of one member of a consolidated alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSource implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String sourceId;
    private String sourceType;
    private Instant createdAt;

    public static AlertSource of(Alert alert) {
        return new AlertSource(alert.getId(), alert.getSourceId(), alert.getSourceType(), alert.getCreatedAt());
    }
}
