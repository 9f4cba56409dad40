package com.anomaly.alerting.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionAlgorithmTest {

    @Test
    void resolvesKeysAndNamesCaseInsensitively() {
        assertThat(DetectionAlgorithm.fromKey("zscore")).isEqualTo(DetectionAlgorithm.ZSCORE);
        assertThat(DetectionAlgorithm.fromKey("ISOLATION_FOREST")).isEqualTo(DetectionAlgorithm.ISOLATION_FOREST);
        assertThat(DetectionAlgorithm.fromKey("Mad")).isEqualTo(DetectionAlgorithm.MAD);
    }

    @Test
    void unknownNameIsRejected() {
        assertThatThrownBy(() -> DetectionAlgorithm.fromKey("prophet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prophet");
    }
}
