package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.AnomalySeverity;
import org.springframework.stereotype.Component;

/**
 * Maps a percent deviation to a severity tier. Higher sensitivity lowers every tier boundary:
 * critical at 100-5s (50..95), high at 50-2s (30..48), medium at 20-s (10..19).
 */
@Component
public class SeverityClassifier {

    public AnomalySeverity classify(double deviationPercent, int sensitivity) {
        double absDeviation = Math.abs(deviationPercent);
        if (absDeviation >= criticalThreshold(sensitivity)) return AnomalySeverity.CRITICAL;
        if (absDeviation >= highThreshold(sensitivity)) return AnomalySeverity.HIGH;
        if (absDeviation >= mediumThreshold(sensitivity)) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }

    static double criticalThreshold(int sensitivity) {
        return 100 - sensitivity * 5.0;
    }

    static double highThreshold(int sensitivity) {
        return 50 - sensitivity * 2.0;
    }

    static double mediumThreshold(int sensitivity) {
        return 20 - sensitivity;
    }
}
