package com.anomaly.alerting.alert;

import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregate counts over the alerts raised in a time range. Severity and type maps always
 * carry every tier and type, zero when absent.
 */
@Value
@Builder
public class AnomalyStatistics {

    long total;
    Map<AnomalySeverity, Long> bySeverity;
    Map<AnomalyType, Long> byType;
    Map<String, Long> byMetric;
    long resolved;
    long unresolved;
    /** Mean minutes from alertedAt to resolvedAt over resolved alerts that carry resolvedAt; 0 if none. */
    double averageResolutionTime;
}
