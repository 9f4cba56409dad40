package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.AnomalyAlert;

import java.util.Locale;

final class AlertMessages {

    private AlertMessages() {
    }

    /** One-line human summary, e.g. {@code [HIGH] revenue SPIKE: observed 500.00, expected 100.00 (+400.0%)}. */
    static String summary(AnomalyAlert alert) {
        Anomaly anomaly = alert.getAnomaly();
        return String.format(Locale.ROOT, "[%s] %s %s: observed %.2f, expected %.2f (%+.1f%%) - %s",
                anomaly.getSeverity(), anomaly.getMetric(), anomaly.getType(),
                anomaly.getObservedValue(), anomaly.getExpectedValue(), anomaly.getDeviation(),
                anomaly.getDescription());
    }
}
