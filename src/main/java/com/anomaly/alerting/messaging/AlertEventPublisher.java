package com.anomaly.alerting.messaging;

/**
 * Outbound channel for alert lifecycle events. Implementations never throw: a failed
 * publish is logged and the lifecycle operation that triggered it still succeeds.
 */
public interface AlertEventPublisher {

    void publish(AlertLifecycleEvent event);
}
