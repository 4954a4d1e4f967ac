package com.company.consolidation.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Derived geospatial index data: the geohash of the alert and, when known,
 * the affected area geometry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeospatialData implements Serializable {
    private static final long serialVersionUID = 1L;

    private String geohash;
    private JsonNode affectedArea;

    public boolean hasAffectedArea() {
        return affectedArea != null && !affectedArea.isNull() && !affectedArea.isMissingNode();
    }

    public int geohashLength() {
        return geohash != null ? geohash.length() : 0;
    }
}
