package com.anomaly.alerting.investigation;

import lombok.Value;

/**
 * Another metric's value and percent change at the time of an alert.
 */
@Value
public class RelatedMetric {
    String metric;
    double value;
    double change;
}
