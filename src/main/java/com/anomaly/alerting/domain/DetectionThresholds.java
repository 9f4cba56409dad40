package com.anomaly.alerting.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional hard bounds for a metric. Either side may be absent.
 */
@Value
@Builder
@Jacksonized
public class DetectionThresholds {

    Double min;
    Double max;
}
