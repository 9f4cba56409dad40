package com.anomaly.alerting.detection;

import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.AnomalySeverity;
import com.anomaly.alerting.domain.AnomalyType;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for AnomalyDetector with the real algorithm set.
 */
class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(
                List.of(new ZScoreAlgorithm(), new IqrAlgorithm(), new MadAlgorithm(), new IsolationScoreAlgorithm()),
                new SeverityClassifier(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void flatSeriesAtItsOwnValueProducesNothing() {
        List<Anomaly> anomalies = detector.detect(allAlgorithms(5), Collections.nCopies(7, 10.0), 10.0);

        assertThat(anomalies).isEmpty();
    }

    @Test
    void largeSpikeOverFlatHistoryIsFlaggedByEveryAlgorithmFromSensitivityFive() {
        for (int s = 5; s <= 10; s++) {
            final int sensitivity = s;
            List<Anomaly> anomalies = detector.detect(allAlgorithms(sensitivity), Collections.nCopies(30, 100.0), 500.0);

            assertThat(anomalies).as("sensitivity %d", sensitivity).hasSize(4);
            assertThat(anomalies).extracting(Anomaly::getAlgorithm).containsExactly(
                    DetectionAlgorithm.ZSCORE, DetectionAlgorithm.IQR, DetectionAlgorithm.MAD, DetectionAlgorithm.ISOLATION_FOREST);
            assertThat(anomalies).allSatisfy(a -> {
                assertThat(a.getType()).isEqualTo(AnomalyType.SPIKE);
                assertThat(a.getObservedValue()).isEqualTo(500.0);
                assertThat(a.getMetric()).isEqualTo("revenue");
                assertThat(a.getTimestamp()).isEqualTo(NOW);
                assertThat(a.getSensitivity()).isEqualTo(sensitivity);
            });
        }
    }

    @Test
    void spikeCarriesExpectedValueAndSeverityFromDeviation() {
        List<Anomaly> anomalies = detector.detect(config(5, List.of(DetectionAlgorithm.MAD), null),
                Collections.nCopies(30, 100.0), 500.0);

        assertThat(anomalies).hasSize(1);
        Anomaly mad = anomalies.get(0);
        assertThat(mad.getExpectedValue()).isEqualTo(100.0);
        assertThat(mad.getDeviation()).isCloseTo(400.0, within(1e-9));
        assertThat(mad.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(mad.getId()).isNotBlank();
    }

    @Test
    void dropBelowHalfTheMeanIsTypedDrop() {
        List<Double> history = new ArrayList<>(Collections.nCopies(20, 100.0));
        history.addAll(Arrays.asList(98.0, 102.0, 99.0, 101.0));

        List<Anomaly> anomalies = detector.detect(config(7, List.of(DetectionAlgorithm.ZSCORE), null), history, 10.0);

        assertThat(anomalies).singleElement().satisfies(a -> assertThat(a.getType()).isEqualTo(AnomalyType.DROP));
    }

    @Test
    void fewerThanSevenHistoryPointsYieldsNothing() {
        DetectionConfig config = config(10, List.of(DetectionAlgorithm.ZSCORE), DetectionThresholds.builder().max(1.0).build());

        assertThat(detector.detect(config, Collections.nCopies(6, 100.0), 10_000.0)).isEmpty();
        assertThat(detector.detect(config, null, 10_000.0)).isEmpty();
    }

    @Test
    void nonFiniteCurrentValueYieldsNothing() {
        assertThat(detector.detect(allAlgorithms(5), Collections.nCopies(10, 100.0), Double.NaN)).isEmpty();
    }

    @Test
    void maxThresholdBreachIsAlwaysHigh() {
        for (int sensitivity = 1; sensitivity <= 10; sensitivity++) {
            DetectionConfig config = config(sensitivity, List.of(), DetectionThresholds.builder().max(100.0).build());

            List<Anomaly> anomalies = detector.detect(config, Collections.nCopies(7, 90.0), 150.0);

            assertThat(anomalies).as("sensitivity %d", sensitivity).singleElement().satisfies(a -> {
                assertThat(a.getType()).isEqualTo(AnomalyType.THRESHOLD_BREACH);
                assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
                assertThat(a.getExpectedValue()).isEqualTo(100.0);
                assertThat(a.getDeviation()).isCloseTo(50.0, within(1e-9));
                assertThat(a.getAlgorithm()).isNull();
            });
        }
    }

    @Test
    void minimumIsCheckedBeforeMaximum() {
        DetectionConfig config = config(5, List.of(), DetectionThresholds.builder().min(10.0).max(5.0).build());

        List<Anomaly> anomalies = detector.detect(config, Collections.nCopies(7, 8.0), 7.0);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getExpectedValue()).isEqualTo(10.0);
            assertThat(a.getDescription()).contains("below minimum");
        });
    }

    @Test
    void breachOfZeroBoundReportsZeroDeviation() {
        DetectionConfig config = config(5, List.of(), DetectionThresholds.builder().min(0.0).build());

        List<Anomaly> anomalies = detector.detect(config, Collections.nCopies(7, 3.0), -2.0);

        assertThat(anomalies).singleElement().satisfies(a -> assertThat(a.getDeviation()).isZero());
    }

    @Test
    void algorithmsAndThresholdProduceSeparateCandidates() {
        DetectionConfig config = config(5, List.of(DetectionAlgorithm.ZSCORE),
                DetectionThresholds.builder().max(200.0).build());

        List<Anomaly> anomalies = detector.detect(config, Collections.nCopies(30, 100.0), 500.0);

        assertThat(anomalies).extracting(Anomaly::getType)
                .containsExactly(AnomalyType.SPIKE, AnomalyType.THRESHOLD_BREACH);
        assertThat(anomalies.get(0).getId()).isNotEqualTo(anomalies.get(1).getId());
    }

    @Test
    void nullHistoryEntriesAreIgnored() {
        List<Double> history = new ArrayList<>(Collections.nCopies(7, 10.0));
        history.add(null);

        assertThat(detector.detect(allAlgorithms(5), history, 10.0)).isEmpty();
    }

    @Test
    void zeroMeanSeriesNeverFlags() {
        List<Double> history = Arrays.asList(-1.0, 1.0, -1.0, 1.0, -1.0, 1.0, -1.0, 1.0);

        assertThat(detector.detect(allAlgorithms(10), history, 0.0)).isEmpty();
    }

    private static DetectionConfig allAlgorithms(int sensitivity) {
        return config(sensitivity, Arrays.asList(DetectionAlgorithm.values()), null);
    }

    private static DetectionConfig config(int sensitivity, List<DetectionAlgorithm> algorithms, DetectionThresholds thresholds) {
        return DetectionConfig.builder()
                .metric("revenue")
                .enabled(true)
                .sensitivity(sensitivity)
                .algorithms(algorithms)
                .thresholds(thresholds)
                .build();
    }
}
