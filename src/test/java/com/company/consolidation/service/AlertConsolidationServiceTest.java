package com.company.consolidation.service;

import com.company.consolidation.AlertFixtures;
import com.company.consolidation.config.ScoringConfig;
import com.company.consolidation.domain.Alert;
import com.company.consolidation.dto.response.ConsolidationBatchResult;
import com.company.consolidation.dto.response.ConsolidationDetail;
import com.company.consolidation.exception.AlertStorageException;
import com.company.consolidation.exception.InvalidBatchRequestException;
import com.company.consolidation.repository.AlertRepository;
import com.company.consolidation.util.ConsolidatedAlertIds;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AlertConsolidationServiceTest {

    private static final Instant NOW = Instant.parse("2023-01-01T11:00:00Z");

    private AlertRepository alertRepository;
    private MeterRegistry meterRegistry;
    private AlertConsolidationService service;

    @BeforeEach
    void setUp() {
        alertRepository = mock(AlertRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AlertSimilarityScorer scorer = new AlertSimilarityScorer();

        service = new AlertConsolidationService(
                alertRepository,
                new GreedySeedClustering(scorer),
                new AlertConsolidationMerger(clock),
                new ConsolidationPersister(alertRepository, clock),
                ScoringConfig.defaults(),
                clock,
                OpenTelemetry.noop().getTracer("test"),
                meterRegistry);
    }

    @Test
    void shouldReturnEmptyResultWhenNothingToFetch() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of());

        ConsolidationBatchResult result = service.runBatch(60, 100);

        assertTrue(result.isEmpty());
        assertEquals(0, result.getGroupsFound());
        assertNull(result.getDetails());
        verify(alertRepository, never()).putAlert(any());
        assertEquals(1.0, meterRegistry.counter("consolidation.batches.completed").count());
    }

    @Test
    void shouldFetchWithinTimeWindow() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of());

        service.runBatch(30, 50);

        verify(alertRepository).fetchUnconsolidated(Instant.parse("2023-01-01T10:30:00Z"), 50);
    }

    @Test
    void shouldConsolidateRelatedAlerts() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of(
                AlertFixtures.californiaQuake(), AlertFixtures.sanFranciscoQuake(),
                AlertFixtures.kansasTornado(), AlertFixtures.floridaHurricane()));

        ConsolidationBatchResult result = service.runBatch(60, 100);

        assertEquals(4, result.getTotal());
        assertEquals(1, result.getGroupsFound());
        assertEquals(2, result.getAlertsConsolidated());
        assertEquals(1, result.getConsolidatedAlertsCreated());

        String expectedId = ConsolidatedAlertIds.forMembers(List.of("1", "2"));
        ConsolidationDetail detail = result.getDetails().get(0);
        assertEquals(expectedId, detail.getConsolidatedAlertId());
        assertEquals(2, detail.getOriginalAlertCount());
        assertEquals(List.of("1", "2"), detail.getOriginalAlertIds());

        ArgumentCaptor<Alert> stored = ArgumentCaptor.forClass(Alert.class);
        verify(alertRepository).putAlert(stored.capture());
        assertEquals(expectedId, stored.getValue().getId());
        assertEquals("Earthquake near San Francisco", stored.getValue().getHeadline());
        assertEquals(List.of("1", "2"), stored.getValue().getConsolidatedFrom());

        verify(alertRepository).markConsolidated(List.of("1", "2"), expectedId, NOW);
        assertEquals(2.0, meterRegistry.counter("consolidation.alerts.consolidated").count());
        assertEquals(1.0, meterRegistry.counter("consolidation.groups.found").count());
    }

    @Test
    void shouldReportNoGroupsForUnrelatedAlerts() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of(
                AlertFixtures.californiaQuake(), AlertFixtures.kansasTornado(), AlertFixtures.floridaHurricane()));

        ConsolidationBatchResult result = service.runBatch(60, 100);

        assertEquals(3, result.getTotal());
        assertEquals(0, result.getGroupsFound());
        assertFalse(result.isEmpty());
        verify(alertRepository, never()).markConsolidated(anyList(), anyString(), any());
    }

    @Test
    void shouldRethrowStorageFailure() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of(
                AlertFixtures.californiaQuake(), AlertFixtures.sanFranciscoQuake()));
        doThrow(new AlertStorageException("Failed to save alert", new RuntimeException("connection reset")))
                .when(alertRepository).putAlert(any());

        assertThrows(AlertStorageException.class, () -> service.runBatch(60, 100));

        verify(alertRepository, never()).markConsolidated(anyList(), anyString(), any());
        assertEquals(1.0, meterRegistry.counter("consolidation.batches.failed").count());
        assertEquals(0.0, meterRegistry.counter("consolidation.batches.completed").count());
    }

    @Test
    void shouldRethrowFetchFailure() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt()))
                .thenThrow(new AlertStorageException("Failed to fetch unconsolidated alerts", null));

        assertThrows(AlertStorageException.class, () -> service.runBatch(60, 100));
    }

    @Test
    void shouldRejectNonPositiveParameters() {
        assertThrows(InvalidBatchRequestException.class, () -> service.runBatch(0, 100));
        assertThrows(InvalidBatchRequestException.class, () -> service.runBatch(60, -1));

        verifyNoInteractions(alertRepository);
    }

    @Test
    void shouldRecordBatchDuration() {
        when(alertRepository.fetchUnconsolidated(any(), anyInt())).thenReturn(List.of());

        service.runBatch(60, 100);
        service.runBatch(60, 100);

        assertEquals(2, meterRegistry.timer("consolidation.batch.duration").count());
    }
}
