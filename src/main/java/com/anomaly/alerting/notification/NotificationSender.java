package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AnomalyAlert;

/**
 * Transport for one alert channel. {@link #send} either returns normally (delivered) or throws.
 */
public interface NotificationSender {

    AlertChannel channel();

    void send(AnomalyAlert alert);
}
