package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import com.anomaly.alerting.domain.InvalidDetectionConfigException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bean-validation constraints on {@link DetectionConfig} plus the cross-field threshold rules.
 */
@Component
@RequiredArgsConstructor
public class DetectionConfigValidator {

    private final Validator validator;

    public void validate(DetectionConfig config) {
        if (config == null) {
            throw new InvalidDetectionConfigException("Detection config is required");
        }
        Set<ConstraintViolation<DetectionConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining("; "));
            throw new InvalidDetectionConfigException("Invalid detection config for metric '" + config.getMetric() + "': " + details);
        }

        DetectionThresholds thresholds = config.getThresholds();
        if (thresholds == null) return;
        Double min = thresholds.getMin();
        Double max = thresholds.getMax();
        if (min != null && !Double.isFinite(min)) {
            throw new InvalidDetectionConfigException("Minimum threshold for metric '" + config.getMetric() + "' must be finite");
        }
        if (max != null && !Double.isFinite(max)) {
            throw new InvalidDetectionConfigException("Maximum threshold for metric '" + config.getMetric() + "' must be finite");
        }
        if (min != null && max != null && min > max) {
            throw new InvalidDetectionConfigException("Minimum threshold " + min + " exceeds maximum " + max
                    + " for metric '" + config.getMetric() + "'");
        }
    }
}
