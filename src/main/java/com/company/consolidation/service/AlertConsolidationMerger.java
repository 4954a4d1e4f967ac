package com.company.consolidation.service;

import com.company.consolidation.domain.AiClassification;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.domain.AlertSource;
import com.company.consolidation.domain.GeospatialData;
import com.company.consolidation.domain.enums.ConsolidationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Merges a group of related alerts into one enriched primary record.
 *
 * The newest member (by createdAt, first one wins on ties) provides every
 * field not covered by a merge rule below.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertConsolidationMerger {

    // sentence terminators, except a '.' between two digits (decimal point)
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+(?!\\d)|(?<!\\d)[.!?]+");

    private final Clock clock;

    public Alert consolidate(List<Alert> group) {
        if (group == null || group.size() < 2) {
            throw new IllegalArgumentException("Consolidation requires at least two alerts");
        }

        Alert base = newest(group);

        Alert.AlertBuilder consolidated = base.toBuilder()
                .consolidationStatus(ConsolidationStatus.PRIMARY)
                .consolidatedInto(null)
                .consolidatedFrom(group.stream().map(Alert::getId).toList())
                .sourceCount(group.size())
                .sources(group.stream().map(AlertSource::of).toList())
                .enhancedDescription(enhancedDescription(group))
                .updatedAt(clock.instant());

        GeospatialData geospatialData = bestGeospatialData(group);
        if (geospatialData != null) {
            consolidated.geospatialData(geospatialData);
        }

        Map<String, String> parameters = mergeParameters(group);
        if (!parameters.isEmpty()) {
            consolidated.parameters(parameters);
        }

        AiClassification classification = mostSevereClassification(group);
        if (classification != null) {
            consolidated.aiClassification(classification);
        }

        log.debug("Merged {} alerts on base {}", group.size(), base.getId());
        return consolidated.build();
    }

    private Alert newest(List<Alert> group) {
        Alert newest = group.get(0);
        for (Alert alert : group) {
            if (isAfter(alert.getCreatedAt(), newest.getCreatedAt())) {
                newest = alert;
            }
        }
        return newest;
    }

    private boolean isAfter(Instant candidate, Instant current) {
        if (candidate == null) return false;
        if (current == null) return true;
        return candidate.isAfter(current);
    }

    /**
     * Unique sentence fragments of all descriptions, first-seen order,
     * joined with ". " and terminated by a period.
     */
    String enhancedDescription(List<Alert> group) {
        Set<String> sentences = new LinkedHashSet<>();
        for (Alert alert : group) {
            if (alert.getDescription() == null) {
                continue;
            }
            for (String fragment : SENTENCE_BOUNDARY.split(alert.getDescription())) {
                String sentence = fragment.trim();
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
            }
        }

        if (sentences.isEmpty()) {
            return null;
        }
        return String.join(". ", sentences) + ".";
    }

    /**
     * Prefers data with an affected area, then the most precise geohash.
     */
    private GeospatialData bestGeospatialData(List<Alert> group) {
        GeospatialData best = null;
        for (Alert alert : group) {
            GeospatialData candidate = alert.getGeospatialData();
            if (candidate == null) {
                continue;
            }
            if (best == null || isMoreDetailed(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private boolean isMoreDetailed(GeospatialData candidate, GeospatialData current) {
        if (candidate.hasAffectedArea() != current.hasAffectedArea()) {
            return candidate.hasAffectedArea();
        }
        return candidate.geohashLength() > current.geohashLength();
    }

    /**
     * Key-by-key union; on collision the longer value wins, the first seen on equal length.
     */
    private Map<String, String> mergeParameters(List<Alert> group) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (Alert alert : group) {
            if (alert.getParameters() == null) {
                continue;
            }
            alert.getParameters().forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                String existing = merged.get(key);
                if (existing == null || value.length() > existing.length()) {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    private AiClassification mostSevereClassification(List<Alert> group) {
        AiClassification mostSevere = null;
        for (Alert alert : group) {
            AiClassification candidate = alert.getAiClassification();
            if (candidate == null) {
                continue;
            }
            if (mostSevere == null || candidate.severityOrZero() > mostSevere.severityOrZero()) {
                mostSevere = candidate;
            }
        }
        return mostSevere;
    }
}
