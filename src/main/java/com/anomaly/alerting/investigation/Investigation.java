package com.anomaly.alerting.investigation;

import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Context assembled around one alert for an operator looking into it.
 */
@Value
@Builder
public class Investigation {

    AnomalyAlert alert;
    /** The metric's values over the 30 days ending at the alert. */
    List<HistoricalPoint> historicalData;
    /** Always empty; cross-metric correlation is not implemented. */
    List<RelatedMetric> relatedMetrics;
    /** Up to five earlier alerts for the same metric and type within the preceding 7 days, newest first. */
    List<AnomalyAlert> similarAnomalies;
    List<TimelineEntry> timeline;
}
