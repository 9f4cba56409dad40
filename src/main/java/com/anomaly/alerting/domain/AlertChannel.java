package com.anomaly.alerting.domain;

/**
 * Notification channel an alert can be delivered through.
 */
public enum AlertChannel {
    EMAIL,
    SLACK,
    WEBHOOK
}
