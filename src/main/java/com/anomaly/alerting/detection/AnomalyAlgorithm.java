package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionAlgorithm;

/**
 * One statistical detector. Implementations are stateless and must never return NaN or throw
 * for degenerate samples (zero spread, zero expected value); they report "no anomaly" instead.
 */
public interface AnomalyAlgorithm {

    DetectionAlgorithm algorithm();

    /** Decision threshold for the given sensitivity (1-10). Non-increasing in sensitivity. */
    double threshold(int sensitivity);

    /**
     * @param sample  evaluation sample; its last element is {@code current}
     * @param current observed value under test
     */
    AlgorithmResult evaluate(double[] sample, double current, int sensitivity);

    /** SPIKE above 150% of expected, DROP below 50%, OUTLIER otherwise. */
    static AnomalyType typeRelativeTo(double current, double expected) {
        if (current > expected * 1.5) return AnomalyType.SPIKE;
        if (current < expected * 0.5) return AnomalyType.DROP;
        return AnomalyType.OUTLIER;
    }
}
