package com.anomaly.alerting.domain;

/**
 * Severity tier of an anomaly. Drives dashboards and routing (e.g. critical → page on-call).
 */
public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
