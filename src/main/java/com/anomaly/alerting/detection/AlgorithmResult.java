package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.AnomalyType;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one algorithm evaluated against one sample.
 */
@Value
@Builder
public class AlgorithmResult {

    boolean anomaly;
    AnomalyType type;
    double deviation;
    double expectedValue;
    /** Algorithm-specific statistic (z-score, modified z-score, isolation score, ...). */
    double score;
    double threshold;
    String description;

    static AlgorithmResult notAnomalous(double expectedValue, double threshold, String description) {
        return AlgorithmResult.builder()
                .anomaly(false)
                .type(AnomalyType.OUTLIER)
                .deviation(0.0)
                .expectedValue(expectedValue)
                .score(0.0)
                .threshold(threshold)
                .description(description)
                .build();
    }
}
