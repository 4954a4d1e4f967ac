package com.company.consolidation.config;

import com.company.consolidation.domain.enums.SimilarityComponent;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable scoring parameters handed to the scorer and the grouping
 * strategies.
 */
@Getter
@ToString
public final class ScoringConfig {

    public static final double DEFAULT_RELATION_THRESHOLD = 0.7;
    public static final double DEFAULT_DUPLICATE_THRESHOLD = 0.9;
    public static final double DEFAULT_LOCATION_DECAY_KM = 50.0;

    private final Map<SimilarityComponent, Double> weights;
    private final double relationThreshold;
    private final double duplicateThreshold;
    private final double locationDecayKm;

    public ScoringConfig(Map<SimilarityComponent, Double> weights,
                         double relationThreshold,
                         double duplicateThreshold,
                         double locationDecayKm) {
        EnumMap<SimilarityComponent, Double> copy = new EnumMap<>(SimilarityComponent.class);
        for (SimilarityComponent component : SimilarityComponent.values()) {
            Double weight = weights.get(component);
            if (weight == null || weight.isNaN() || weight < 0) {
                throw new IllegalArgumentException("Invalid weight for " + component.getKey() + ": " + weight);
            }
            copy.put(component, weight);
        }
        checkRatio("relationThreshold", relationThreshold);
        checkRatio("duplicateThreshold", duplicateThreshold);
        if (!(locationDecayKm > 0)) {
            throw new IllegalArgumentException("locationDecayKm must be positive: " + locationDecayKm);
        }

        this.weights = Collections.unmodifiableMap(copy);
        this.relationThreshold = relationThreshold;
        this.duplicateThreshold = duplicateThreshold;
        this.locationDecayKm = locationDecayKm;
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(defaultWeights(),
                DEFAULT_RELATION_THRESHOLD, DEFAULT_DUPLICATE_THRESHOLD, DEFAULT_LOCATION_DECAY_KM);
    }

    public static ScoringConfig from(ConsolidationProperties.Scoring scoring) {
        ConsolidationProperties.Weights w = scoring.getWeights();
        Map<SimilarityComponent, Double> weights = new EnumMap<>(SimilarityComponent.class);
        weights.put(SimilarityComponent.HEADLINE, w.getHeadline());
        weights.put(SimilarityComponent.DESCRIPTION, w.getDescription());
        weights.put(SimilarityComponent.LOCATION, w.getLocation());
        weights.put(SimilarityComponent.EVENT_TYPE, w.getEventType());
        weights.put(SimilarityComponent.TIME_OVERLAP, w.getTimeOverlap());

        return new ScoringConfig(weights,
                scoring.getRelationThreshold(), scoring.getDuplicateThreshold(), scoring.getLocationDecayKm());
    }

    public ScoringConfig withRelationThreshold(double threshold) {
        return new ScoringConfig(weights, threshold, duplicateThreshold, locationDecayKm);
    }

    public double weight(SimilarityComponent component) {
        return weights.get(component);
    }

    private static Map<SimilarityComponent, Double> defaultWeights() {
        Map<SimilarityComponent, Double> weights = new EnumMap<>(SimilarityComponent.class);
        weights.put(SimilarityComponent.HEADLINE, 0.25);
        weights.put(SimilarityComponent.DESCRIPTION, 0.25);
        weights.put(SimilarityComponent.LOCATION, 0.30);
        weights.put(SimilarityComponent.EVENT_TYPE, 0.10);
        weights.put(SimilarityComponent.TIME_OVERLAP, 0.10);
        return weights;
    }

    private static void checkRatio(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
