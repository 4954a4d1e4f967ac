package com.company.consolidation.config;

import com.company.consolidation.domain.enums.SimilarityComponent;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringConfigTest {

    @Test
    void shouldProvideDefaults() {
        ScoringConfig config = ScoringConfig.defaults();

        assertEquals(0.25, config.weight(SimilarityComponent.HEADLINE));
        assertEquals(0.25, config.weight(SimilarityComponent.DESCRIPTION));
        assertEquals(0.30, config.weight(SimilarityComponent.LOCATION));
        assertEquals(0.10, config.weight(SimilarityComponent.EVENT_TYPE));
        assertEquals(0.10, config.weight(SimilarityComponent.TIME_OVERLAP));
        assertEquals(0.7, config.getRelationThreshold());
        assertEquals(0.9, config.getDuplicateThreshold());
        assertEquals(50.0, config.getLocationDecayKm());
    }

    @Test
    void shouldBuildFromProperties() {
        ConsolidationProperties.Scoring scoring = new ConsolidationProperties.Scoring();
        scoring.getWeights().setLocation(0.5);
        scoring.setRelationThreshold(0.6);
        scoring.setLocationDecayKm(25.0);

        ScoringConfig config = ScoringConfig.from(scoring);

        assertEquals(0.5, config.weight(SimilarityComponent.LOCATION));
        assertEquals(0.25, config.weight(SimilarityComponent.HEADLINE));
        assertEquals(0.6, config.getRelationThreshold());
        assertEquals(25.0, config.getLocationDecayKm());
    }

    @Test
    void shouldRejectNegativeOrMissingWeights() {
        Map<SimilarityComponent, Double> weights = weights(0.2);
        weights.put(SimilarityComponent.HEADLINE, -0.1);
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(weights, 0.7, 0.9, 50));

        Map<SimilarityComponent, Double> missing = weights(0.2);
        missing.remove(SimilarityComponent.TIME_OVERLAP);
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(missing, 0.7, 0.9, 50));

        Map<SimilarityComponent, Double> nan = weights(0.2);
        nan.put(SimilarityComponent.LOCATION, Double.NaN);
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(nan, 0.7, 0.9, 50));
    }

    @Test
    void shouldRejectThresholdsOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(weights(0.2), 1.1, 0.9, 50));
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(weights(0.2), 0.7, -0.1, 50));
        assertThrows(IllegalArgumentException.class, () -> ScoringConfig.defaults().withRelationThreshold(Double.NaN));
    }

    @Test
    void shouldRejectNonPositiveDecay() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringConfig(weights(0.2), 0.7, 0.9, 0));
    }

    @Test
    void shouldAcceptZeroWeights() {
        ScoringConfig config = new ScoringConfig(weights(0.0), 0.0, 1.0, 1.0);

        assertEquals(0.0, config.weight(SimilarityComponent.HEADLINE));
    }

    @Test
    void shouldNotExposeMutableWeights() {
        Map<SimilarityComponent, Double> source = weights(0.2);
        ScoringConfig config = new ScoringConfig(source, 0.7, 0.9, 50);
        source.put(SimilarityComponent.HEADLINE, 0.9);

        assertEquals(0.2, config.weight(SimilarityComponent.HEADLINE));
        assertThrows(UnsupportedOperationException.class,
                () -> config.getWeights().put(SimilarityComponent.HEADLINE, 1.0));
    }

    private static Map<SimilarityComponent, Double> weights(double value) {
        Map<SimilarityComponent, Double> weights = new EnumMap<>(SimilarityComponent.class);
        for (SimilarityComponent component : SimilarityComponent.values()) {
            weights.put(component, value);
        }
        return weights;
    }
}
