package com.anomaly.alerting.domain;

/**
 * Kind of deviation an anomaly represents. Derived from the relation of the observed value
 * to the expected value; never chosen independently of the numbers.
 */
public enum AnomalyType {
    /** Observed value well above the expected level. */
    SPIKE,
    /** Observed value well below the expected level. */
    DROP,
    TREND_CHANGE,
    /** Statistically unusual but within 50%-150% of the expected level. */
    OUTLIER,
    PATTERN_BREAK,
    /** Observed value outside an operator-configured min/max bound. */
    THRESHOLD_BREACH
}
