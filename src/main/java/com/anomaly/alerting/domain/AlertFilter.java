package com.anomaly.alerting.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for alert queries. Null fields match everything.
 */
@Value
@Builder
public class AlertFilter {

    public static final AlertFilter NONE = AlertFilter.builder().build();

    String metric;
    AnomalySeverity severity;
    AnomalyType type;
    /** Lower bound on alertedAt, inclusive. */
    Instant from;
    /** Upper bound on alertedAt, inclusive. */
    Instant to;

    public boolean matches(AnomalyAlert alert) {
        Anomaly anomaly = alert.getAnomaly();
        if (metric != null && !metric.equals(anomaly.getMetric())) return false;
        if (severity != null && severity != anomaly.getSeverity()) return false;
        if (type != null && type != anomaly.getType()) return false;
        if (from != null && alert.getAlertedAt().isBefore(from)) return false;
        if (to != null && alert.getAlertedAt().isAfter(to)) return false;
        return true;
    }
}
