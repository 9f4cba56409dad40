package com.anomaly.alerting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single deviation produced by one detection run (one algorithm, or the threshold check)
 * against one metric. Immutable; wrapped by {@link AnomalyAlert} once accepted.
 */
@Value
@Builder
@Jacksonized
public class Anomaly {

    String id;
    String metric;
    AnomalyType type;
    AnomalySeverity severity;
    double observedValue;
    /** Mean, median or breached bound, depending on the producing check. */
    double expectedValue;
    /** Percent deviation of the observed value from the expected value. */
    double deviation;
    Instant timestamp;
    String description;
    /** Producing algorithm; null for threshold breaches. */
    DetectionAlgorithm algorithm;
    /** Sensitivity the producing config had at detection time. */
    Integer sensitivity;
}
