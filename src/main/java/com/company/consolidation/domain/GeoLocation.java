package com.company.consolidation.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * GeoJSON geometry (Point, Polygon or MultiPolygon). Coordinates are kept
 * as raw JSON since their nesting depends on the geometry type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String POINT = "Point";
    public static final String POLYGON = "Polygon";
    public static final String MULTI_POLYGON = "MultiPolygon";

    private String type;
    private JsonNode coordinates;

    /**
     * GeoJSON order: longitude first.
     */
    public static GeoLocation point(double longitude, double latitude) {
        ArrayNode coordinates = JsonNodeFactory.instance.arrayNode()
                .add(longitude)
                .add(latitude);
        return new GeoLocation(POINT, coordinates);
    }

    @JsonIgnore
    public boolean isPoint() {
        return POINT.equals(type);
    }

    /**
     * @return the longitude, or NaN when the coordinates are missing or not numeric
     */
    @JsonIgnore
    public double getLongitude() {
        return coordinate(0);
    }

    /**
     * @return the latitude, or NaN when the coordinates are missing or not numeric
     */
    @JsonIgnore
    public double getLatitude() {
        return coordinate(1);
    }

    private double coordinate(int index) {
        if (coordinates == null || !coordinates.isArray() || coordinates.size() <= index) {
            return Double.NaN;
        }
        JsonNode value = coordinates.get(index);
        return value.isNumber() ? value.asDouble() : Double.NaN;
    }
}
