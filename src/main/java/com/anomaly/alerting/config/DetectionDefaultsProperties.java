package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Binding for {@code anomaly.detection.*}: the configs written to the database the first
 * time the config store is used on an empty schema.
 *
 * <pre>
 * anomaly:
 *   detection:
 *     defaults:
 *       - metric: error_rate
 *         sensitivity: 9
 *         algorithms: [zscore, iqr, mad]
 *         thresholds:
 *           max: 5
 *         alert-channels: [EMAIL, SLACK, WEBHOOK]
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionDefaultsProperties {

    private List<MetricDefaults> defaults = new ArrayList<>();

    public List<DetectionConfig> toDetectionConfigs() {
        return defaults.stream().map(MetricDefaults::toDetectionConfig).collect(Collectors.toList());
    }

    @Data
    public static class MetricDefaults {
        private String metric;
        private boolean enabled = true;
        private int sensitivity = 5;
        private List<DetectionAlgorithm> algorithms = new ArrayList<>();
        private Thresholds thresholds;
        private List<AlertChannel> alertChannels = new ArrayList<>();

        DetectionConfig toDetectionConfig() {
            return DetectionConfig.builder()
                    .metric(metric)
                    .enabled(enabled)
                    .sensitivity(sensitivity)
                    .algorithms(algorithms)
                    .thresholds(thresholds == null ? null
                            : DetectionThresholds.builder().min(thresholds.getMin()).max(thresholds.getMax()).build())
                    .alertChannels(alertChannels)
                    .build();
        }
    }

    @Data
    public static class Thresholds {
        private Double min;
        private Double max;
    }
}
