package com.anomaly.alerting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the anomaly alerting service. Provides:
 * <ul>
 *   <li>Scheduled statistical detection (z-score, IQR, MAD, isolation score) over daily metrics</li>
 *   <li>Alert lifecycle with cooldown-based deduplication (Redis)</li>
 *   <li>Lifecycle events on Kafka and best-effort email/Slack/webhook notification</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class AnomalyAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyAlertingApplication.class, args);
    }
}
