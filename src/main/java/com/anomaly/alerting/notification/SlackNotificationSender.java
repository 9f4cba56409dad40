package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts a text message to a Slack incoming webhook. Without a configured URL the message is logged.
 */
@Slf4j
@Component
public class SlackNotificationSender implements NotificationSender {

    private final RestTemplate restTemplate;

    @Value("${anomaly.notification.slack.webhook-url:}")
    private String webhookUrl;

    public SlackNotificationSender(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.SLACK;
    }

    @Override
    public void send(AnomalyAlert alert) {
        String text = AlertMessages.summary(alert);
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("[SLACK ALERT] alertId={} {}", alert.getId(), text);
            return;
        }
        restTemplate.postForEntity(webhookUrl, Map.of("text", text), String.class);
        log.info("Delivered alert {} to Slack", alert.getId());
    }
}
