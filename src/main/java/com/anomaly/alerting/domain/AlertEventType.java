package com.anomaly.alerting.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle events published for every alert transition.
 */
public enum AlertEventType {
    ANOMALY_DETECTED("anomaly-detected"),
    ANOMALY_ACKNOWLEDGED("anomaly-acknowledged"),
    ANOMALY_RESOLVED("anomaly-resolved");

    private final String eventName;

    AlertEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
