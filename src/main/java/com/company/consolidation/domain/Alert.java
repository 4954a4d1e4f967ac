package com.company.consolidation.domain;

import com.company.consolidation.domain.enums.ConsolidationStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Hazard alert as ingested from a source, or a consolidated record built
 * from several of them.
 *
 * Fields from {@code consolidatedFrom} to {@code enhancedDescription} are
 * populated only for {@link ConsolidationStatus#PRIMARY} records.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert implements Serializable {
    private static final long serialVersionUID = 1L;

    // Primary key
    private String id;

    // Provenance
    private String sourceId;
    private String sourceType;
    private Instant createdAt;
    private Instant updatedAt;

    // Classification
    private String eventType;
    private AiClassification aiClassification;

    // Content
    private String headline;
    private String description;

    // Geography
    private GeoLocation location;
    private GeospatialData geospatialData;

    // Time; a missing end time means the event is instantaneous
    private Instant startTime;
    private Instant endTime;

    private Map<String, String> parameters;

    // Consolidation state
    @Builder.Default
    private ConsolidationStatus consolidationStatus = ConsolidationStatus.NONE;
    private String consolidatedInto;

    // Consolidated record only
    private List<String> consolidatedFrom;
    private Integer sourceCount;
    private List<AlertSource> sources;
    private String enhancedDescription;

    public Instant effectiveEndTime() {
        return endTime != null ? endTime : startTime;
    }

    @JsonIgnore
    public boolean isPrimary() {
        return consolidationStatus == ConsolidationStatus.PRIMARY;
    }

    @JsonIgnore
    public boolean isConsolidated() {
        return consolidationStatus == ConsolidationStatus.CONSOLIDATED;
    }
}
