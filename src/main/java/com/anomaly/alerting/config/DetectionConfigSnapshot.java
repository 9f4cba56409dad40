package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.DetectionConfig;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Cached copy of every detection config, as stored under {@code anomaly:configs}.
 */
@Value
@Builder
@Jacksonized
public class DetectionConfigSnapshot {

    @Singular
    List<DetectionConfig> configs;

    Instant loadedAt;
}
