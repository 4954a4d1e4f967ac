package com.company.consolidation.util;

import com.company.consolidation.domain.enums.SimilarityComponent;
import com.company.consolidation.domain.enums.SimilarityLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class SimilarityScore {
    private double overallScore;
    private Map<SimilarityComponent, Double> componentScores;
    private SimilarityLevel level;

    public boolean has(SimilarityComponent component) {
        return componentScores.containsKey(component);
    }

    public Double component(SimilarityComponent component) {
        return componentScores.get(component);
    }
}
