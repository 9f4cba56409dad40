package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.DetectionAlgorithm;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Modified z-score (Iglewicz-Hoaglin) based on the median absolute deviation. Threshold runs
 * from 3.5 (sensitivity 0) down to 2.5 (sensitivity 10).
 * <p>
 * When more than half the sample sits exactly on the median, MAD is zero; the score then
 * uses the mean absolute deviation scaled by 1.253314 so a single outlier in an otherwise
 * flat series is still visible. A sample with no spread at all scores 0.
 */
@Component
public class MadAlgorithm implements AnomalyAlgorithm {

    private static final double CONSISTENCY_CONSTANT = 0.6745;
    private static final double MEAN_AD_SCALE = 1.253314;

    @Override
    public DetectionAlgorithm algorithm() {
        return DetectionAlgorithm.MAD;
    }

    @Override
    public double threshold(int sensitivity) {
        return 3.5 - (sensitivity / 10.0) * 1.0;
    }

    @Override
    public AlgorithmResult evaluate(double[] sample, double current, int sensitivity) {
        double median = SeriesStatistics.median(sample);
        double threshold = threshold(sensitivity);
        if (median == 0.0) {
            return AlgorithmResult.notAnomalous(median, threshold, "MAD skipped: median is zero");
        }

        double[] deviations = SeriesStatistics.absoluteDeviations(sample, median);
        double mad = SeriesStatistics.median(deviations);
        double modifiedZScore;
        if (mad > 0.0) {
            modifiedZScore = CONSISTENCY_CONSTANT * (current - median) / mad;
        } else {
            double meanAbsoluteDeviation = SeriesStatistics.mean(deviations);
            modifiedZScore = meanAbsoluteDeviation > 0.0
                    ? (current - median) / (MEAN_AD_SCALE * meanAbsoluteDeviation)
                    : 0.0;
        }

        return AlgorithmResult.builder()
                .anomaly(Math.abs(modifiedZScore) > threshold)
                .type(AnomalyAlgorithm.typeRelativeTo(current, median))
                .deviation(SeriesStatistics.percentDeviation(current, median))
                .expectedValue(median)
                .score(modifiedZScore)
                .threshold(threshold)
                .description(String.format(Locale.ROOT, "Modified Z-score: %.2f, threshold: %.2f", modifiedZScore, threshold))
                .build();
    }
}
