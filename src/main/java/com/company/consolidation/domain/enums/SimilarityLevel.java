package com.company.consolidation.domain.enums;

public enum SimilarityLevel {
    DUPLICATE,
    RELATED,
    UNRELATED;

    public static SimilarityLevel of(double overallScore, double relationThreshold, double duplicateThreshold) {
        if (overallScore >= duplicateThreshold) {
            return DUPLICATE;
        }
        if (overallScore >= relationThreshold) {
            return RELATED;
        }
        return UNRELATED;
    }
}
