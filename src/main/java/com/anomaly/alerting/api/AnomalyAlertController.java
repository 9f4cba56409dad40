package com.anomaly.alerting.api;

import com.anomaly.alerting.alert.AlertManager;
import com.anomaly.alerting.alert.AnomalyStatistics;
import com.anomaly.alerting.domain.AlertFilter;
import com.anomaly.alerting.domain.AlertNotFoundException;
import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.investigation.Investigation;
import com.anomaly.alerting.investigation.InvestigationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for anomaly alerts: queries, lifecycle transitions and investigation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/anomalies")
@RequiredArgsConstructor
@Tag(name = "Anomalies", description = "Detected anomaly alerts and their lifecycle")
public class AnomalyAlertController {

    private final AlertManager alertManager;
    private final InvestigationService investigationService;

    @GetMapping("/active")
    @Operation(summary = "List active alerts", description = "Unresolved alerts, newest first. All filters are optional; from/to bound alertedAt (ISO-8601).")
    public ResponseEntity<List<AnomalyAlert>> getActive(
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) AnomalySeverity severity,
            @RequestParam(required = false) AnomalyType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        AlertFilter filter = AlertFilter.builder().metric(metric).severity(severity).type(type).from(from).to(to).build();
        return ResponseEntity.ok(alertManager.getActive(filter));
    }

    @GetMapping("/history")
    @Operation(summary = "Alert history", description = "Alerts raised between from and to in any state, newest first.")
    public ResponseEntity<List<AnomalyAlert>> getHistory(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) AnomalySeverity severity,
            @RequestParam(required = false) AnomalyType type) {
        AlertFilter filter = AlertFilter.builder().metric(metric).severity(severity).type(type).build();
        return ResponseEntity.ok(alertManager.getHistory(new TimeRange(from, to), filter));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Alert statistics", description = "Counts by severity, type and metric plus mean resolution time (minutes) for alerts raised between from and to.")
    public ResponseEntity<AnomalyStatistics> getStatistics(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(alertManager.statistics(new TimeRange(from, to)));
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Get alert")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert found"),
            @ApiResponse(responseCode = "404", description = "Unknown or expired alert. Body: { \"error\": \"ALERT_NOT_FOUND\" }")
    })
    public ResponseEntity<AnomalyAlert> getAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(alertManager.getAlert(alertId).orElseThrow(() -> new AlertNotFoundException(alertId)));
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge alert", description = "Marks the alert as owned by an operator. Re-acknowledging overwrites who and when.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert acknowledged"),
            @ApiResponse(responseCode = "400", description = "acknowledgedBy missing. Body: { \"error\": \"VALIDATION_FAILED\", \"details\": ... }"),
            @ApiResponse(responseCode = "404", description = "Unknown or expired alert"),
            @ApiResponse(responseCode = "409", description = "Alert already resolved")
    })
    public ResponseEntity<AnomalyAlert> acknowledge(@PathVariable String alertId,
                                                    @Valid @RequestBody AcknowledgeRequestDto dto) {
        return ResponseEntity.ok(alertManager.acknowledge(alertId, dto.getAcknowledgedBy()));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve alert", description = "Closes the alert with optional notes. Resolving again overwrites notes and timestamp.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Alert resolved"),
            @ApiResponse(responseCode = "404", description = "Unknown or expired alert")
    })
    public ResponseEntity<AnomalyAlert> resolve(@PathVariable String alertId,
                                                @Valid @RequestBody(required = false) ResolveRequestDto dto) {
        return ResponseEntity.ok(alertManager.resolve(alertId, dto != null ? dto.getNotes() : null));
    }

    @GetMapping("/{alertId}/investigation")
    @Operation(summary = "Investigate alert", description = "30-day metric history, similar recent alerts and the alert's lifecycle timeline.")
    public ResponseEntity<Investigation> investigate(@PathVariable String alertId) {
        return ResponseEntity.ok(investigationService.investigate(alertId));
    }
}
