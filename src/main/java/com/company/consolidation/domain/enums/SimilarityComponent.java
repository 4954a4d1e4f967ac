package com.company.consolidation.domain.enums;

/**
 * Signals that contribute to the pairwise alert similarity score.
 */
public enum SimilarityComponent {
    HEADLINE("headline"),
    DESCRIPTION("description"),
    LOCATION("location"),
    EVENT_TYPE("eventType"),
    TIME_OVERLAP("timeOverlap");

    private final String key;

    SimilarityComponent(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
