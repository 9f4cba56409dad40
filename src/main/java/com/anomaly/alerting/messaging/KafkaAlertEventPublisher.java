package com.anomaly.alerting.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes lifecycle events to Kafka, keyed by metric so one metric's events stay ordered
 * within a partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "anomaly.events.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaAlertEventPublisher implements AlertEventPublisher {

    private final KafkaTemplate<String, AlertLifecycleEvent> alertEventKafkaTemplate;

    @Value("${anomaly.events.kafka.topic:anomaly-alert-events}")
    private String topic;

    @Override
    public void publish(AlertLifecycleEvent event) {
        try {
            CompletableFuture<SendResult<String, AlertLifecycleEvent>> future =
                    alertEventKafkaTemplate.send(topic, event.getMetric(), event);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send {} event for alert {}", event.getEventType().getEventName(), event.getAlertId(), ex);
                else log.debug("Sent {} event for alert {} partition={}", event.getEventType().getEventName(), event.getAlertId(),
                        result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Failed to send {} event for alert {}", event.getEventType().getEventName(), event.getAlertId(), e);
        }
    }
}
