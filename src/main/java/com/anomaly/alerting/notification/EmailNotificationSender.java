package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Email channel. Logs the rendered message; SMTP transport lives outside this service.
 */
@Slf4j
@Component
public class EmailNotificationSender implements NotificationSender {

    @Value("${anomaly.notification.email.recipients:}")
    private String recipients;

    @Override
    public AlertChannel channel() {
        return AlertChannel.EMAIL;
    }

    @Override
    public void send(AnomalyAlert alert) {
        log.info("[EMAIL ALERT] to={} alertId={} {}",
                recipients.isBlank() ? "<unconfigured>" : recipients, alert.getId(), AlertMessages.summary(alert));
    }
}
