package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.DetectionAlgorithm;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Flags values more than {@code t} population standard deviations from the mean,
 * with {@code t} between 1.5 (sensitivity 10) and 3.0.
 */
@Component
public class ZScoreAlgorithm implements AnomalyAlgorithm {

    @Override
    public DetectionAlgorithm algorithm() {
        return DetectionAlgorithm.ZSCORE;
    }

    @Override
    public double threshold(int sensitivity) {
        return 3.0 - (sensitivity / 10.0) * 1.5;
    }

    @Override
    public AlgorithmResult evaluate(double[] sample, double current, int sensitivity) {
        double mean = SeriesStatistics.mean(sample);
        double stdDev = SeriesStatistics.populationStdDev(sample, mean);
        double threshold = threshold(sensitivity);
        if (stdDev == 0.0 || mean == 0.0) {
            return AlgorithmResult.notAnomalous(mean, threshold,
                    String.format(Locale.ROOT, "Z-score: 0.00, threshold: %.2f (no spread)", threshold));
        }

        double zScore = Math.abs(current - mean) / stdDev;
        return AlgorithmResult.builder()
                .anomaly(zScore > threshold)
                .type(AnomalyAlgorithm.typeRelativeTo(current, mean))
                .deviation(SeriesStatistics.percentDeviation(current, mean))
                .expectedValue(mean)
                .score(zScore)
                .threshold(threshold)
                .description(String.format(Locale.ROOT, "Z-score: %.2f, threshold: %.2f", zScore, threshold))
                .build();
    }
}
