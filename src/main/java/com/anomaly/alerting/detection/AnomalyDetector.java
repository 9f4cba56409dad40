package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.DoubleStream;

/**
 * Runs every algorithm a config enables against a metric's history plus its current value,
 * then the min/max threshold check. Each algorithm that fires yields its own candidate;
 * candidates are not merged here, the alert manager's cooldown takes care of duplicates.
 * <p>
 * Pure computation over an in-memory buffer: no I/O, no shared state.
 */
@Slf4j
@Component
public class AnomalyDetector {

    /** Fewer history points than this and the metric is skipped for the sweep. */
    public static final int MIN_HISTORY_POINTS = 7;

    private final Map<DetectionAlgorithm, AnomalyAlgorithm> algorithms;
    private final SeverityClassifier severityClassifier;
    private final Clock clock;

    public AnomalyDetector(List<AnomalyAlgorithm> algorithms, SeverityClassifier severityClassifier, Clock clock) {
        this.algorithms = new EnumMap<>(DetectionAlgorithm.class);
        for (AnomalyAlgorithm algorithm : algorithms) {
            this.algorithms.put(algorithm.algorithm(), algorithm);
        }
        this.severityClassifier = severityClassifier;
        this.clock = clock;
    }

    /**
     * @param history ascending observations preceding {@code current}
     * @param current the newest observation
     * @return zero or more candidates; empty when history is shorter than {@link #MIN_HISTORY_POINTS}
     */
    public List<Anomaly> detect(DetectionConfig config, List<Double> history, double current) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (history == null || history.size() < MIN_HISTORY_POINTS) {
            log.debug("Insufficient history for metric={}: {} points (need {})",
                    config.getMetric(), history == null ? 0 : history.size(), MIN_HISTORY_POINTS);
            return anomalies;
        }
        if (!Double.isFinite(current)) {
            log.warn("Skipping metric={}: current value {} is not finite", config.getMetric(), current);
            return anomalies;
        }

        double[] sample = toSample(history, current);
        Instant now = clock.instant();

        for (DetectionAlgorithm algorithmType : config.getAlgorithms()) {
            AnomalyAlgorithm algorithm = algorithms.get(algorithmType);
            if (algorithm == null) {
                throw new IllegalStateException("No implementation registered for algorithm " + algorithmType.getKey());
            }
            AlgorithmResult result = algorithm.evaluate(sample, current, config.getSensitivity());
            log.debug("metric={} algorithm={} score={} threshold={} anomaly={}",
                    config.getMetric(), algorithmType.getKey(), result.getScore(), result.getThreshold(), result.isAnomaly());
            if (result.isAnomaly()) {
                anomalies.add(Anomaly.builder()
                        .id(UUID.randomUUID().toString())
                        .metric(config.getMetric())
                        .type(result.getType())
                        .severity(severityClassifier.classify(result.getDeviation(), config.getSensitivity()))
                        .observedValue(current)
                        .expectedValue(result.getExpectedValue())
                        .deviation(result.getDeviation())
                        .timestamp(now)
                        .description(result.getDescription())
                        .algorithm(algorithmType)
                        .sensitivity(config.getSensitivity())
                        .build());
            }
        }

        checkThresholds(config, current, now).ifPresent(anomalies::add);
        return anomalies;
    }

    /**
     * Hard bound check. A breach is always HIGH regardless of deviation; the minimum is checked first.
     */
    Optional<Anomaly> checkThresholds(DetectionConfig config, double current, Instant now) {
        DetectionThresholds thresholds = config.getThresholds();
        if (thresholds == null) return Optional.empty();

        if (thresholds.getMin() != null && current < thresholds.getMin()) {
            return Optional.of(thresholdBreach(config, current, thresholds.getMin(), now,
                    String.format(Locale.ROOT, "Value %.2f below minimum threshold %.2f", current, thresholds.getMin())));
        }
        if (thresholds.getMax() != null && current > thresholds.getMax()) {
            return Optional.of(thresholdBreach(config, current, thresholds.getMax(), now,
                    String.format(Locale.ROOT, "Value %.2f above maximum threshold %.2f", current, thresholds.getMax())));
        }
        return Optional.empty();
    }

    private static Anomaly thresholdBreach(DetectionConfig config, double current, double bound, Instant now, String description) {
        return Anomaly.builder()
                .id(UUID.randomUUID().toString())
                .metric(config.getMetric())
                .type(AnomalyType.THRESHOLD_BREACH)
                .severity(AnomalySeverity.HIGH)
                .observedValue(current)
                .expectedValue(bound)
                .deviation(SeriesStatistics.percentDeviation(current, bound))
                .timestamp(now)
                .description(description)
                .algorithm(null)
                .sensitivity(config.getSensitivity())
                .build();
    }

    private static double[] toSample(List<Double> history, double current) {
        return DoubleStream.concat(
                        history.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue),
                        DoubleStream.of(current))
                .toArray();
    }
}
