package com.anomaly.alerting.investigation;

import com.anomaly.alerting.alert.AlertManager;
import com.anomaly.alerting.domain.AlertNotFoundException;
import com.anomaly.alerting.domain.AlertFilter;
import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class InvestigationService {

    static final Duration HISTORY_WINDOW = Duration.ofDays(30);
    static final Duration SIMILAR_WINDOW = Duration.ofDays(7);
    static final int MAX_SIMILAR = 5;

    private final AlertManager alertManager;
    private final MetricSource metricSource;

    /**
     * @throws AlertNotFoundException if the alert does not exist or has expired
     */
    public Investigation investigate(String alertId) {
        AnomalyAlert alert = alertManager.getAlert(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));

        return Investigation.builder()
                .alert(alert)
                .historicalData(history(alert))
                .relatedMetrics(List.of())
                .similarAnomalies(similar(alert))
                .timeline(timeline(alert))
                .build();
    }

    /** Point i is dated range start + i days; the source returns one value per day. */
    private List<HistoricalPoint> history(AnomalyAlert alert) {
        TimeRange range = TimeRange.ending(alert.getAlertedAt(), HISTORY_WINDOW);
        List<Double> values;
        try {
            values = metricSource.getHistory(alert.getAnomaly().getMetric(), range);
        } catch (RuntimeException e) {
            log.warn("History unavailable for investigation of alert {} (metric={}): {}",
                    alert.getId(), alert.getAnomaly().getMetric(), e.getMessage());
            return List.of();
        }
        LocalDate start = LocalDate.ofInstant(range.getStart(), ZoneOffset.UTC);
        List<HistoricalPoint> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            points.add(new HistoricalPoint(start.plusDays(i), values.get(i)));
        }
        return points;
    }

    private List<AnomalyAlert> similar(AnomalyAlert alert) {
        AlertFilter filter = AlertFilter.builder()
                .metric(alert.getAnomaly().getMetric())
                .type(alert.getAnomaly().getType())
                .build();
        return alertManager.getHistory(TimeRange.ending(alert.getAlertedAt(), SIMILAR_WINDOW), filter).stream()
                .filter(a -> !a.getId().equals(alert.getId()))
                .limit(MAX_SIMILAR)
                .collect(Collectors.toList());
    }

    private static List<TimelineEntry> timeline(AnomalyAlert alert) {
        List<TimelineEntry> timeline = new ArrayList<>();
        timeline.add(new TimelineEntry(alert.getAlertedAt(), "Anomaly Detected", alert.getAnomaly().getDescription()));
        if (alert.isAcknowledged() && alert.getAcknowledgedAt() != null) {
            timeline.add(new TimelineEntry(alert.getAcknowledgedAt(), "Acknowledged", "By " + alert.getAcknowledgedBy()));
        }
        if (alert.isResolved() && alert.getResolvedAt() != null) {
            String notes = alert.getNotes() == null || alert.getNotes().isBlank() ? "No notes provided" : alert.getNotes();
            timeline.add(new TimelineEntry(alert.getResolvedAt(), "Resolved", notes));
        }
        timeline.sort(Comparator.comparing(TimelineEntry::getTimestamp));
        return timeline;
    }
}
