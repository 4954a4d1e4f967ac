package com.company.consolidation.service;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.domain.GeoLocation;
import com.company.consolidation.domain.GeospatialData;
import com.company.consolidation.domain.enums.SimilarityComponent;
import com.company.consolidation.domain.enums.SimilarityLevel;
import com.company.consolidation.util.GeoUtils;
import com.company.consolidation.util.SimilarityScore;
import com.company.consolidation.util.TextSimilarity;
import com.company.consolidation.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weighted pairwise similarity of two alerts.
 *
 * Components that cannot be computed for a pair (a field missing on either
 * side) or that evaluate to NaN are left out of both the weighted sum and
 * the total weight, so the score is normalised over what was comparable.
 */
@Service
@Slf4j
public class AlertSimilarityScorer {

    public SimilarityScore score(Alert alert1, Alert alert2, ScoringConfig config) {
        Map<SimilarityComponent, Double> scores = new EnumMap<>(SimilarityComponent.class);

        // Check 1: headline text
        if (hasText(alert1.getHeadline()) && hasText(alert2.getHeadline())) {
            put(scores, SimilarityComponent.HEADLINE,
                    TextSimilarity.textSimilarity(alert1.getHeadline(), alert2.getHeadline()));
        }

        // Check 2: description text
        if (hasText(alert1.getDescription()) && hasText(alert2.getDescription())) {
            put(scores, SimilarityComponent.DESCRIPTION,
                    TextSimilarity.textSimilarity(alert1.getDescription(), alert2.getDescription()));
        }

        // Check 3: event type, exact match only
        if (hasText(alert1.getEventType()) && hasText(alert2.getEventType())) {
            put(scores, SimilarityComponent.EVENT_TYPE,
                    alert1.getEventType().equals(alert2.getEventType()) ? 1.0 : 0.0);
        }

        // Check 4: location, point distance first, geohash prefix as fallback
        Double location = locationScore(alert1, alert2, config.getLocationDecayKm());
        if (location != null) {
            put(scores, SimilarityComponent.LOCATION, location);
        }

        // Check 5: time overlap, end time defaults to start time
        if (alert1.getStartTime() != null && alert2.getStartTime() != null) {
            put(scores, SimilarityComponent.TIME_OVERLAP, TimeUtils.timeOverlapRatio(
                    alert1.getStartTime(), alert1.effectiveEndTime(),
                    alert2.getStartTime(), alert2.effectiveEndTime()));
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<SimilarityComponent, Double> entry : scores.entrySet()) {
            double weight = config.weight(entry.getKey());
            weightedSum += entry.getValue() * weight;
            totalWeight += weight;
        }

        // guard against rounding above 1.0
        double overall = totalWeight > 0 ? Math.min(1.0, weightedSum / totalWeight) : 0.0;

        SimilarityLevel level = SimilarityLevel.of(
                overall, config.getRelationThreshold(), config.getDuplicateThreshold());

        return new SimilarityScore(overall, Collections.unmodifiableMap(scores), level);
    }

    private Double locationScore(Alert alert1, Alert alert2, double decayKm) {
        GeoLocation location1 = alert1.getLocation();
        GeoLocation location2 = alert2.getLocation();

        if (location1 != null && location2 != null && location1.isPoint() && location2.isPoint()) {
            double distanceKm = GeoUtils.haversineDistanceKm(
                    location1.getLatitude(), location1.getLongitude(),
                    location2.getLatitude(), location2.getLongitude());
            return GeoUtils.distanceDecay(distanceKm, decayKm);
        }

        GeospatialData geo1 = alert1.getGeospatialData();
        GeospatialData geo2 = alert2.getGeospatialData();
        if (geo1 != null && geo2 != null && hasText(geo1.getGeohash()) && hasText(geo2.getGeohash())) {
            return GeoUtils.geohashSimilarity(geo1.getGeohash(), geo2.getGeohash());
        }

        return null;
    }

    private void put(Map<SimilarityComponent, Double> scores, SimilarityComponent component, double value) {
        if (Double.isNaN(value)) {
            log.debug("Dropping {} component: score is NaN", component.getKey());
            return;
        }
        scores.put(component, value);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
