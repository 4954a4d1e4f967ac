package com.company.consolidation.service;

import com.company.consolidation.domain.Alert;
import com.company.consolidation.domain.enums.ConsolidationStatus;
import com.company.consolidation.repository.AlertRepository;
import com.company.consolidation.util.ConsolidatedAlertIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes one consolidated group: the primary record, then the members'
 * CONSOLIDATED status. Both writes share one transaction, and the primary
 * id is derived from the member ids, so a retried group converges on the
 * same record.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConsolidationPersister {

    private final AlertRepository alertRepository;
    private final Clock clock;

    @Transactional
    public Alert persistGroup(Alert consolidated, List<String> memberIds) {
        Instant now = clock.instant();

        Alert primary = consolidated.toBuilder()
                .id(ConsolidatedAlertIds.forMembers(memberIds))
                .consolidationStatus(ConsolidationStatus.PRIMARY)
                .consolidatedInto(null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        alertRepository.putAlert(primary);
        alertRepository.markConsolidated(memberIds, primary.getId(), now);

        log.info("Created consolidated alert {} from {} alerts", primary.getId(), memberIds.size());
        return primary;
    }
}
