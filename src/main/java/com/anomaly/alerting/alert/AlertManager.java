package com.anomaly.alerting.alert;

import com.anomaly.alerting.domain.AlertNotFoundException;
import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AlertEventType;
import com.anomaly.alerting.domain.AlertFilter;
import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.messaging.AlertEventPublisher;
import com.anomaly.alerting.messaging.AlertLifecycleEvent;
import com.anomaly.alerting.notification.DeliveryStatus;
import com.anomaly.alerting.notification.NotificationDispatcher;
import com.anomaly.alerting.store.AlertStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns detected anomalies into alerts and owns their lifecycle. Duplicate (metric, type)
 * detections inside the cooldown window are dropped; accepted alerts are stored for 24h,
 * announced as lifecycle events and dispatched to the config's channels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertManager {

    public static final Duration ALERT_TTL = Duration.ofHours(24);
    public static final Duration COOLDOWN = Duration.ofMinutes(15);

    private static final Comparator<AnomalyAlert> NEWEST_FIRST =
            Comparator.comparing(AnomalyAlert::getAlertedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final AlertStore alertStore;
    private final AlertEventPublisher eventPublisher;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    /**
     * @return the new alert, or empty when a cooldown for the anomaly's (metric, type) is active
     */
    public Optional<AnomalyAlert> process(Anomaly anomaly, DetectionConfig config) {
        if (alertStore.isCoolingDown(anomaly.getMetric(), anomaly.getType())) {
            log.debug("Suppressed duplicate anomaly metric={} type={} (cooldown active)", anomaly.getMetric(), anomaly.getType());
            return Optional.empty();
        }

        AnomalyAlert alert = AnomalyAlert.open(anomaly, clock.instant());
        alertStore.save(alert, ALERT_TTL);
        alertStore.startCooldown(anomaly.getMetric(), anomaly.getType(), COOLDOWN);
        publish(AlertEventType.ANOMALY_DETECTED, alert);

        List<AlertChannel> channels = config.getAlertChannels();
        Map<AlertChannel, DeliveryStatus> deliveries = notificationDispatcher.dispatch(alert, channels);
        log.info("Anomaly detected: metric={}, type={}, severity={}, alertId={}, deliveries={}",
                anomaly.getMetric(), anomaly.getType(), anomaly.getSeverity(), alert.getId(), deliveries);
        return Optional.of(alert);
    }

    /**
     * @throws AlertNotFoundException if no such alert is stored
     * @throws com.anomaly.alerting.domain.IllegalAlertTransitionException if the alert is resolved
     */
    public AnomalyAlert acknowledge(String alertId, String acknowledgedBy) {
        AnomalyAlert alert = findAlert(alertId);
        alert.acknowledge(acknowledgedBy, clock.instant());
        alertStore.save(alert, ALERT_TTL);
        publish(AlertEventType.ANOMALY_ACKNOWLEDGED, alert);
        log.info("[AUDIT] Anomaly alert acknowledged: alertId={}, metric={}, by={}",
                alertId, alert.getAnomaly().getMetric(), acknowledgedBy);
        return alert;
    }

    /**
     * @throws AlertNotFoundException if no such alert is stored
     */
    public AnomalyAlert resolve(String alertId, String notes) {
        AnomalyAlert alert = findAlert(alertId);
        alert.resolve(notes, clock.instant());
        alertStore.save(alert, ALERT_TTL);
        publish(AlertEventType.ANOMALY_RESOLVED, alert);
        log.info("[AUDIT] Anomaly alert resolved: alertId={}, metric={}, hasNotes={}",
                alertId, alert.getAnomaly().getMetric(), notes != null && !notes.isBlank());
        return alert;
    }

    public Optional<AnomalyAlert> getAlert(String alertId) {
        return alertStore.findById(alertId);
    }

    /** Unresolved alerts matching the filter, newest first. */
    public List<AnomalyAlert> getActive(AlertFilter filter) {
        return alertStore.findAll().stream()
                .filter(a -> !a.isResolved())
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    /** Alerts raised within the range in any state, newest first. */
    public List<AnomalyAlert> getHistory(TimeRange range, AlertFilter filter) {
        return alertStore.findAll().stream()
                .filter(a -> range.contains(a.getAlertedAt()))
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public AnomalyStatistics statistics(TimeRange range) {
        List<AnomalyAlert> alerts = getHistory(range, AlertFilter.NONE);

        Map<AnomalySeverity, Long> bySeverity = new EnumMap<>(AnomalySeverity.class);
        for (AnomalySeverity severity : AnomalySeverity.values()) bySeverity.put(severity, 0L);
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) byType.put(type, 0L);
        Map<String, Long> byMetric = new TreeMap<>();

        long resolved = 0;
        long resolutionMillis = 0;
        long timedResolutions = 0;
        for (AnomalyAlert alert : alerts) {
            Anomaly anomaly = alert.getAnomaly();
            bySeverity.merge(anomaly.getSeverity(), 1L, Long::sum);
            byType.merge(anomaly.getType(), 1L, Long::sum);
            byMetric.merge(anomaly.getMetric(), 1L, Long::sum);
            if (alert.isResolved()) {
                resolved++;
                if (alert.getResolvedAt() != null) {
                    resolutionMillis += Duration.between(alert.getAlertedAt(), alert.getResolvedAt()).toMillis();
                    timedResolutions++;
                }
            }
        }

        return AnomalyStatistics.builder()
                .total(alerts.size())
                .bySeverity(bySeverity)
                .byType(byType)
                .byMetric(byMetric)
                .resolved(resolved)
                .unresolved(alerts.size() - resolved)
                .averageResolutionTime(timedResolutions > 0 ? resolutionMillis / (double) timedResolutions / 60_000.0 : 0.0)
                .build();
    }

    private AnomalyAlert findAlert(String alertId) {
        return alertStore.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    private void publish(AlertEventType type, AnomalyAlert alert) {
        Instant now = clock.instant();
        eventPublisher.publish(AlertLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .alertId(alert.getId())
                .metric(alert.getAnomaly().getMetric())
                .occurredAt(now)
                .alert(alert.toBuilder().build())
                .build());
    }
}
