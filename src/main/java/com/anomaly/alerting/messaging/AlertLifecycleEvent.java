package com.anomaly.alerting.messaging;

import com.anomaly.alerting.domain.AlertEventType;
import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One alert lifecycle transition as published to {@code anomaly-alert-events}.
 * Carries a full snapshot of the alert after the transition.
 */
@Value
@Builder
@Jacksonized
public class AlertLifecycleEvent {

    String eventId;
    AlertEventType eventType;
    String alertId;
    String metric;
    Instant occurredAt;
    AnomalyAlert alert;
}
