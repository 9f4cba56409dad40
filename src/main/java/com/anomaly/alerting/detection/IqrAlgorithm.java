package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Tukey fences: flags values outside {@code [q1 - m*iqr, q3 + m*iqr]}, with the multiplier
 * {@code m} between 1.5 (sensitivity 10) and 2.85 (sensitivity 1).
 */
@Component
public class IqrAlgorithm implements AnomalyAlgorithm {

    @Override
    public DetectionAlgorithm algorithm() {
        return DetectionAlgorithm.IQR;
    }

    @Override
    public double threshold(int sensitivity) {
        return 1.5 + (10 - sensitivity) * 0.15;
    }

    @Override
    public AlgorithmResult evaluate(double[] sample, double current, int sensitivity) {
        double[] sorted = SeriesStatistics.sorted(sample);
        double q1 = SeriesStatistics.quantile(sorted, 0.25);
        double q3 = SeriesStatistics.quantile(sorted, 0.75);
        double median = SeriesStatistics.quantile(sorted, 0.5);
        double multiplier = threshold(sensitivity);
        if (median == 0.0) {
            return AlgorithmResult.notAnomalous(median, multiplier, "IQR skipped: median is zero");
        }

        double iqr = q3 - q1;
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        AnomalyType type = AnomalyType.OUTLIER;
        if (current > upperBound) type = AnomalyType.SPIKE;
        else if (current < lowerBound) type = AnomalyType.DROP;

        return AlgorithmResult.builder()
                .anomaly(current < lowerBound || current > upperBound)
                .type(type)
                .deviation(SeriesStatistics.percentDeviation(current, median))
                .expectedValue(median)
                .score(iqr)
                .threshold(multiplier)
                .description(String.format(Locale.ROOT, "IQR bounds: [%.2f, %.2f]", lowerBound, upperBound))
                .build();
    }
}
