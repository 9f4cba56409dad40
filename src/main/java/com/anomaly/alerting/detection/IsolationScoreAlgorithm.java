package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.DetectionAlgorithm;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Simplified isolation score: distance from the mean in units of 3σ, capped at 1.
 * Threshold runs from 0.7 (sensitivity 0) down to 0.4 (sensitivity 10).
 */
@Component
public class IsolationScoreAlgorithm implements AnomalyAlgorithm {

    @Override
    public DetectionAlgorithm algorithm() {
        return DetectionAlgorithm.ISOLATION_FOREST;
    }

    @Override
    public double threshold(int sensitivity) {
        return 0.7 - (sensitivity / 10.0) * 0.3;
    }

    @Override
    public AlgorithmResult evaluate(double[] sample, double current, int sensitivity) {
        double mean = SeriesStatistics.mean(sample);
        double stdDev = SeriesStatistics.populationStdDev(sample, mean);
        double threshold = threshold(sensitivity);
        if (stdDev == 0.0 || mean == 0.0) {
            return AlgorithmResult.notAnomalous(mean, threshold,
                    String.format(Locale.ROOT, "Isolation score: 0.00, threshold: %.2f (no spread)", threshold));
        }

        double isolationScore = Math.min(1.0, Math.abs(current - mean) / (3.0 * stdDev));
        return AlgorithmResult.builder()
                .anomaly(isolationScore > threshold)
                .type(AnomalyAlgorithm.typeRelativeTo(current, mean))
                .deviation(SeriesStatistics.percentDeviation(current, mean))
                .expectedValue(mean)
                .score(isolationScore)
                .threshold(threshold)
                .description(String.format(Locale.ROOT, "Isolation score: %.2f, threshold: %.2f", isolationScore, threshold))
                .build();
    }
}
