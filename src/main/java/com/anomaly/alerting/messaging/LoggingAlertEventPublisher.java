package com.anomaly.alerting.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes lifecycle events to the log when Kafka publishing is switched off.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "anomaly.events.kafka.enabled", havingValue = "false")
public class LoggingAlertEventPublisher implements AlertEventPublisher {

    @Override
    public void publish(AlertLifecycleEvent event) {
        log.info("Alert event {}: alertId={}, metric={}, state={}",
                event.getEventType().getEventName(), event.getAlertId(), event.getMetric(),
                event.getAlert() != null ? event.getAlert().getState() : null);
    }
}
