package com.company.consolidation.service;

import com.company.consolidation.domain.Alert;
import com.company.consolidation.domain.enums.ConsolidationStatus;
import com.company.consolidation.exception.AlertStorageException;
import com.company.consolidation.repository.AlertRepository;
import com.company.consolidation.util.ConsolidatedAlertIds;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConsolidationPersisterTest {

    private static final Instant NOW = Instant.parse("2023-01-01T11:00:00Z");

    private final AlertRepository alertRepository = mock(AlertRepository.class);
    private final ConsolidationPersister persister =
            new ConsolidationPersister(alertRepository, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldWritePrimaryBeforeMarkingMembers() {
        Alert merged = Alert.builder().id("2").headline("Earthquake").build();
        List<String> members = List.of("1", "2");

        Alert primary = persister.persistGroup(merged, members);

        String expectedId = ConsolidatedAlertIds.forMembers(members);
        assertEquals(expectedId, primary.getId());
        assertEquals(ConsolidationStatus.PRIMARY, primary.getConsolidationStatus());
        assertEquals(NOW, primary.getCreatedAt());
        assertEquals(NOW, primary.getUpdatedAt());

        InOrder inOrder = inOrder(alertRepository);
        inOrder.verify(alertRepository).putAlert(primary);
        inOrder.verify(alertRepository).markConsolidated(members, expectedId, NOW);
    }

    @Test
    void shouldNotMarkMembersWhenPrimaryWriteFails() {
        doThrow(new AlertStorageException("Failed to store alert", new RuntimeException("down")))
                .when(alertRepository).putAlert(any());

        assertThrows(AlertStorageException.class,
                () -> persister.persistGroup(Alert.builder().id("x").build(), List.of("a", "b")));

        verify(alertRepository, never()).markConsolidated(anyList(), anyString(), any());
    }

    @Test
    void shouldProduceSameIdForRetriedGroup() {
        Alert first = persister.persistGroup(Alert.builder().id("a").build(), List.of("a", "b"));
        Alert retry = persister.persistGroup(Alert.builder().id("b").build(), List.of("b", "a"));

        assertEquals(first.getId(), retry.getId());
    }
}
