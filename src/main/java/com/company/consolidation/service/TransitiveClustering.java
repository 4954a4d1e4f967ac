package com.company.consolidation.service;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connected components of the "related" graph: every pair scoring at or
 * above the relation threshold is linked, and linked alerts end up in one
 * group even when they never match each other directly.
 *
 * Groups are ordered by their earliest member, members by input order.
 */
@Slf4j
@RequiredArgsConstructor
public class TransitiveClustering implements AlertGroupingStrategy {

    public static final String NAME = "transitive";

    private final AlertSimilarityScorer scorer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<List<Alert>> group(List<Alert> alerts, ScoringConfig config) {
        List<Alert> unique = distinctById(alerts);
        int[] parent = new int[unique.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        for (int i = 0; i < unique.size(); i++) {
            for (int j = i + 1; j < unique.size(); j++) {
                double score = scorer.score(unique.get(i), unique.get(j), config).getOverallScore();
                if (score >= config.getRelationThreshold()) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<Alert>> components = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            components.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(unique.get(i));
        }

        List<List<Alert>> groups = new ArrayList<>();
        for (List<Alert> component : components.values()) {
            if (component.size() > 1) {
                groups.add(component);
            }
        }

        log.debug("Transitive grouping of {} alerts produced {} groups", unique.size(), groups.size());
        return groups;
    }

    private List<Alert> distinctById(List<Alert> alerts) {
        Set<String> seen = new HashSet<>();
        List<Alert> unique = new ArrayList<>();
        for (Alert alert : alerts) {
            if (seen.add(alert.getId())) {
                unique.add(alert);
            }
        }
        return unique;
    }

    private int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        // keep the smaller index as root so components are keyed by their first member
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }
}
