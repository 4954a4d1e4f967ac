package com.company.consolidation.service;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.util.SimilarityScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Single-pass, seed-based grouping.
 *
 * The first unprocessed alert in input order seeds a group; every later
 * unprocessed alert joins it when its score against the seed reaches the
 * relation threshold. Membership is decided against the seed only, so the
 * result is a partition but not a transitive closure: if A matches B and B
 * matches C while A does not match C, C stays out of A's group.
 */
@Slf4j
@RequiredArgsConstructor
public class GreedySeedClustering implements AlertGroupingStrategy {

    public static final String NAME = "greedy-seed";

    private final AlertSimilarityScorer scorer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<List<Alert>> group(List<Alert> alerts, ScoringConfig config) {
        List<List<Alert>> groups = new ArrayList<>();
        Set<String> processed = new HashSet<>();

        for (int i = 0; i < alerts.size(); i++) {
            Alert seed = alerts.get(i);
            if (!processed.add(seed.getId())) {
                continue;
            }

            List<Alert> group = new ArrayList<>();
            group.add(seed);

            for (int j = i + 1; j < alerts.size(); j++) {
                Alert candidate = alerts.get(j);
                if (processed.contains(candidate.getId())) {
                    continue;
                }

                SimilarityScore similarity = scorer.score(seed, candidate, config);
                log.debug("Alert {} vs seed {}: {} ({})", candidate.getId(), seed.getId(),
                        similarity.getOverallScore(), similarity.getLevel());

                if (similarity.getOverallScore() >= config.getRelationThreshold()) {
                    group.add(candidate);
                    processed.add(candidate.getId());
                }
            }

            if (group.size() > 1) {
                groups.add(group);
            }
        }

        return groups;
    }
}
