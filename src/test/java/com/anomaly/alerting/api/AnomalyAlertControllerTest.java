package com.anomaly.alerting.api;

import com.anomaly.alerting.alert.AlertManager;
import com.anomaly.alerting.alert.AnomalyStatistics;
import com.anomaly.alerting.domain.AlertFilter;
import com.anomaly.alerting.domain.AlertNotFoundException;
import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import com.anomaly.alerting.domain.IllegalAlertTransitionException;
import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.investigation.HistoricalPoint;
import com.anomaly.alerting.investigation.Investigation;
import com.anomaly.alerting.investigation.InvestigationService;
import com.anomaly.alerting.investigation.TimelineEntry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AnomalyAlertController using MockMvc.
 */
@WebMvcTest(controllers = AnomalyAlertController.class)
class AnomalyAlertControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AlertManager alertManager;

    @MockitoBean
    private InvestigationService investigationService;

    @Test
    void activeAppliesFiltersAndReturnsAlerts() throws Exception {
        when(alertManager.getActive(any())).thenReturn(List.of(alert()));

        mockMvc.perform(get("/api/v1/anomalies/active")
                        .param("metric", "revenue")
                        .param("severity", "HIGH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("a-1"))
                .andExpect(jsonPath("$[0].state").value("OPEN"))
                .andExpect(jsonPath("$[0].anomaly.metric").value("revenue"))
                .andExpect(jsonPath("$[0].anomaly.algorithm").value("zscore"));

        ArgumentCaptor<AlertFilter> filter = ArgumentCaptor.forClass(AlertFilter.class);
        verify(alertManager).getActive(filter.capture());
        assertThat(filter.getValue().getMetric()).isEqualTo("revenue");
        assertThat(filter.getValue().getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(filter.getValue().getType()).isNull();
    }

    @Test
    void unknownSeverityIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/active").param("severity", "EXTREME"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void historyRequiresRange() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/history").param("from", "2026-03-01T00:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void invertedHistoryRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies/history")
                        .param("from", "2026-03-02T00:00:00Z")
                        .param("to", "2026-03-01T00:00:00Z"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void historyPassesRangeThrough() throws Exception {
        when(alertManager.getHistory(any(), any())).thenReturn(List.of(alert()));

        mockMvc.perform(get("/api/v1/anomalies/history")
                        .param("from", "2026-03-01T00:00:00Z")
                        .param("to", "2026-03-02T00:00:00Z")
                        .param("type", "SPIKE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("a-1"));

        ArgumentCaptor<TimeRange> range = ArgumentCaptor.forClass(TimeRange.class);
        verify(alertManager).getHistory(range.capture(), any());
        assertThat(range.getValue().getStart()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
        assertThat(range.getValue().getEnd()).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
    }

    @Test
    void statisticsReturnsAggregates() throws Exception {
        Map<AnomalySeverity, Long> bySeverity = new EnumMap<>(AnomalySeverity.class);
        bySeverity.put(AnomalySeverity.HIGH, 2L);
        when(alertManager.statistics(any())).thenReturn(AnomalyStatistics.builder()
                .total(2)
                .bySeverity(bySeverity)
                .byType(Map.of(AnomalyType.SPIKE, 2L))
                .byMetric(Map.of("revenue", 2L))
                .resolved(1)
                .unresolved(1)
                .averageResolutionTime(30.0)
                .build());

        mockMvc.perform(get("/api/v1/anomalies/statistics")
                        .param("from", "2026-03-01T00:00:00Z")
                        .param("to", "2026-03-02T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.bySeverity.HIGH").value(2))
                .andExpect(jsonPath("$.byMetric.revenue").value(2))
                .andExpect(jsonPath("$.averageResolutionTime").value(30.0));
    }

    @Test
    void unknownAlertIsNotFound() throws Exception {
        when(alertManager.getAlert("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/anomalies/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ALERT_NOT_FOUND"));
    }

    @Test
    void acknowledgeReturnsUpdatedAlert() throws Exception {
        AnomalyAlert acknowledged = alert();
        acknowledged.acknowledge("alice", T0.plusSeconds(60));
        when(alertManager.acknowledge("a-1", "alice")).thenReturn(acknowledged);

        mockMvc.perform(post("/api/v1/anomalies/a-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "acknowledgedBy": "alice" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value(true))
                .andExpect(jsonPath("$.acknowledgedBy").value("alice"))
                .andExpect(jsonPath("$.acknowledgedAt").value("2026-03-01T10:01:00Z"))
                .andExpect(jsonPath("$.state").value("ACKNOWLEDGED"));
    }

    @Test
    void acknowledgeWithoutOperatorFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/a-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "acknowledgedBy": "" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.acknowledgedBy").value("acknowledgedBy is required"));

        verify(alertManager, never()).acknowledge(any(), any());
    }

    @Test
    void acknowledgeUnknownAlertIsNotFound() throws Exception {
        when(alertManager.acknowledge("missing", "alice")).thenThrow(new AlertNotFoundException("missing"));

        mockMvc.perform(post("/api/v1/anomalies/missing/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "acknowledgedBy": "alice" }
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ALERT_NOT_FOUND"));
    }

    @Test
    void acknowledgeResolvedAlertIsConflict() throws Exception {
        when(alertManager.acknowledge("a-1", "alice"))
                .thenThrow(new IllegalAlertTransitionException("Alert a-1 is resolved and cannot be acknowledged"));

        mockMvc.perform(post("/api/v1/anomalies/a-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "acknowledgedBy": "alice" }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ILLEGAL_ALERT_TRANSITION"));
    }

    @Test
    void resolveAcceptsMissingBody() throws Exception {
        AnomalyAlert resolved = alert();
        resolved.resolve(null, T0.plusSeconds(600));
        when(alertManager.resolve(eq("a-1"), isNull())).thenReturn(resolved);

        mockMvc.perform(post("/api/v1/anomalies/a-1/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolved").value(true))
                .andExpect(jsonPath("$.state").value("RESOLVED"));
    }

    @Test
    void resolvePassesNotes() throws Exception {
        AnomalyAlert resolved = alert();
        resolved.resolve("Deploy rollback", T0.plusSeconds(600));
        when(alertManager.resolve("a-1", "Deploy rollback")).thenReturn(resolved);

        mockMvc.perform(post("/api/v1/anomalies/a-1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "notes": "Deploy rollback" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notes").value("Deploy rollback"));
    }

    @Test
    void investigationCombinesHistoryAndTimeline() throws Exception {
        when(investigationService.investigate("a-1")).thenReturn(Investigation.builder()
                .alert(alert())
                .historicalData(List.of(new HistoricalPoint(LocalDate.of(2026, 1, 30), 100.0)))
                .relatedMetrics(List.of())
                .similarAnomalies(List.of())
                .timeline(List.of(new TimelineEntry(T0, "Anomaly Detected", "Z-score: 5.48, threshold: 1.95")))
                .build());

        mockMvc.perform(get("/api/v1/anomalies/a-1/investigation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alert.id").value("a-1"))
                .andExpect(jsonPath("$.historicalData[0].date").value("2026-01-30"))
                .andExpect(jsonPath("$.historicalData[0].value").value(100.0))
                .andExpect(jsonPath("$.relatedMetrics").isEmpty())
                .andExpect(jsonPath("$.timeline[0].event").value("Anomaly Detected"));
    }

    @Test
    void investigationOfUnknownAlertIsNotFound() throws Exception {
        when(investigationService.investigate("missing")).thenThrow(new AlertNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/anomalies/missing/investigation"))
                .andExpect(status().isNotFound());
    }

    private static AnomalyAlert alert() {
        return AnomalyAlert.open(Anomaly.builder()
                .id("a-1")
                .metric("revenue")
                .type(AnomalyType.SPIKE)
                .severity(AnomalySeverity.HIGH)
                .observedValue(500)
                .expectedValue(100)
                .deviation(400)
                .timestamp(T0)
                .description("Z-score: 5.48, threshold: 1.95")
                .algorithm(DetectionAlgorithm.ZSCORE)
                .sensitivity(7)
                .build(), T0);
    }
}
