package com.anomaly.alerting.domain;

/**
 * Thrown when an alert id does not resolve to a stored (unexpired) alert. Handler returns HTTP 404.
 */
public class AlertNotFoundException extends RuntimeException {

    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super("Anomaly alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
