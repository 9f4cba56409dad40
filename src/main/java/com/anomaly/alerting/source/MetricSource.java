package com.anomaly.alerting.source;

import com.anomaly.alerting.domain.TimeRange;

import java.util.List;

/**
 * Read side of the metric aggregation pipeline.
 */
public interface MetricSource {

    /**
     * Day-granular values for the metric within the range, oldest first.
     * <p>
     * The detection sweep treats the last value as the current observation and the rest as
     * its history, so a metric needs at least eight values in the range to be evaluated.
     *
     * @throws MetricSourceUnavailableException if the backing store cannot be queried
     */
    List<Double> getHistory(String metric, TimeRange range);
}
