package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs the alert as JSON to the configured endpoint. Without a configured URL the alert is logged.
 */
@Slf4j
@Component
public class WebhookNotificationSender implements NotificationSender {

    private final RestTemplate restTemplate;

    @Value("${anomaly.notification.webhook.url:}")
    private String webhookUrl;

    public WebhookNotificationSender(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.WEBHOOK;
    }

    @Override
    public void send(AnomalyAlert alert) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("[WEBHOOK ALERT] alertId={} {}", alert.getId(), AlertMessages.summary(alert));
            return;
        }
        restTemplate.postForEntity(webhookUrl, alert, String.class);
        log.info("Delivered alert {} to webhook {}", alert.getId(), webhookUrl);
    }
}
