package com.company.consolidation.domain.enums;

public enum ConsolidationStatus {
    NONE("Alert has not been consolidated"),
    PRIMARY("Synthetic record merged from several source alerts"),
    CONSOLIDATED("Alert has been merged into a primary record");

    private final String description;

    ConsolidationStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Column value used by storage. NONE is stored as NULL so that
     * un-consolidated alerts keep matching "status not set" queries.
     */
    public String toColumnValue() {
        return this == NONE ? null : name();
    }

    public static ConsolidationStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return NONE;
        }
        try {
            return ConsolidationStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
