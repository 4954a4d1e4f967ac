package com.company.consolidation.service;

import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;

import java.util.List;

/**
 * Splits a batch of alerts into groups that likely describe the same event.
 *
 * Implementations return only groups of two or more alerts, and no alert
 * may appear in more than one group.
 */
public interface AlertGroupingStrategy {

    /**
     * Name used by the {@code consolidation.grouping.strategy} property
     */
    String name();

    List<List<Alert>> group(List<Alert> alerts, ScoringConfig config);
}
