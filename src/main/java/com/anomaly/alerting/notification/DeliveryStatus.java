package com.anomaly.alerting.notification;

/**
 * Outcome of one channel's delivery attempt. There are no retries.
 */
public enum DeliveryStatus {
    DELIVERED,
    FAILED,
    TIMED_OUT,
    /** No sender is registered for the channel. */
    SKIPPED
}
