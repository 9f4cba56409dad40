package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.DetectionConfig;

import java.util.List;
import java.util.Optional;

/**
 * Per-metric detection configuration. Reads may be served from a cache up to an hour stale;
 * {@link #upsert} invalidates it.
 */
public interface DetectionConfigStore {

    List<DetectionConfig> getAll();

    Optional<DetectionConfig> getByMetric(String metric);

    /**
     * Validates and stores the config, replacing any existing config for the same metric.
     *
     * @throws com.anomaly.alerting.domain.InvalidDetectionConfigException if the config is invalid
     */
    DetectionConfig upsert(DetectionConfig config);
}
