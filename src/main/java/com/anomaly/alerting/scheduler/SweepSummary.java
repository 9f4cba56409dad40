package com.anomaly.alerting.scheduler;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome of one detection sweep over every enabled metric.
 */
@Value
@Builder
@Jacksonized
public class SweepSummary {

    Instant startedAt;
    Instant finishedAt;
    /** Enabled metrics whose history was fetched and run through the detector. */
    int metricsEvaluated;
    /** Enabled metrics skipped for insufficient data or a fetch/detection failure. */
    int metricsSkipped;
    int anomaliesFound;
    /** Anomalies that became alerts; the rest were suppressed by cooldown. */
    int alertsRaised;
}
