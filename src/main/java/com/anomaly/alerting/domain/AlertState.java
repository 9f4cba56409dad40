package com.anomaly.alerting.domain;

/**
 * Lifecycle state of an {@link AnomalyAlert}. RESOLVED is terminal.
 */
public enum AlertState {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED
}
