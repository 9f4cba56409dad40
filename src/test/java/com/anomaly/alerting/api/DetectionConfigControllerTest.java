package com.anomaly.alerting.api;

import com.anomaly.alerting.config.DetectionConfigStore;
import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import com.anomaly.alerting.domain.InvalidDetectionConfigException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for DetectionConfigController using MockMvc.
 */
@WebMvcTest(controllers = DetectionConfigController.class)
class DetectionConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DetectionConfigStore configStore;

    @Test
    void listsConfigsWithAlgorithmKeys() throws Exception {
        when(configStore.getAll()).thenReturn(List.of(errorRate()));

        mockMvc.perform(get("/api/v1/anomalies/configs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].metric").value("error_rate"))
                .andExpect(jsonPath("$[0].sensitivity").value(9))
                .andExpect(jsonPath("$[0].algorithms[0]").value("zscore"))
                .andExpect(jsonPath("$[0].thresholds.max").value(5.0))
                .andExpect(jsonPath("$[0].alertChannels[2]").value("WEBHOOK"));
    }

    @Test
    void unknownMetricIsNotFound() throws Exception {
        when(configStore.getByMetric("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/anomalies/configs/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void upsertAcceptsAlgorithmKeysAndReturnsStoredConfig() throws Exception {
        when(configStore.upsert(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(put("/api/v1/anomalies/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "metric": "error_rate",
                                  "enabled": true,
                                  "sensitivity": 9,
                                  "algorithms": ["zscore", "iqr", "mad"],
                                  "thresholds": { "max": 5 },
                                  "alertChannels": ["EMAIL", "SLACK", "WEBHOOK"]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metric").value("error_rate"));

        ArgumentCaptor<DetectionConfig> saved = ArgumentCaptor.forClass(DetectionConfig.class);
        verify(configStore).upsert(saved.capture());
        assertThat(saved.getValue()).isEqualTo(errorRate());
    }

    @Test
    void sensitivityOutOfRangeFailsValidation() throws Exception {
        mockMvc.perform(put("/api/v1/anomalies/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "metric": "revenue",
                                  "enabled": true,
                                  "sensitivity": 11,
                                  "algorithms": ["zscore"],
                                  "alertChannels": ["EMAIL"]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.sensitivity").exists());

        verify(configStore, never()).upsert(any());
    }

    @Test
    void unknownAlgorithmIsMalformed() throws Exception {
        mockMvc.perform(put("/api/v1/anomalies/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "metric": "revenue",
                                  "enabled": true,
                                  "sensitivity": 5,
                                  "algorithms": ["prophet"],
                                  "alertChannels": ["EMAIL"]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void storeRejectionIsBadRequest() throws Exception {
        when(configStore.upsert(any())).thenThrow(new InvalidDetectionConfigException("thresholds.min must not exceed thresholds.max"));

        mockMvc.perform(put("/api/v1/anomalies/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "metric": "revenue",
                                  "enabled": true,
                                  "sensitivity": 5,
                                  "algorithms": ["zscore"],
                                  "thresholds": { "min": 10, "max": 1 },
                                  "alertChannels": ["EMAIL"]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_DETECTION_CONFIG"));
    }

    private static DetectionConfig errorRate() {
        return DetectionConfig.builder()
                .metric("error_rate")
                .enabled(true)
                .sensitivity(9)
                .algorithm(DetectionAlgorithm.ZSCORE)
                .algorithm(DetectionAlgorithm.IQR)
                .algorithm(DetectionAlgorithm.MAD)
                .thresholds(DetectionThresholds.builder().max(5.0).build())
                .alertChannel(AlertChannel.EMAIL)
                .alertChannel(AlertChannel.SLACK)
                .alertChannel(AlertChannel.WEBHOOK)
                .build();
    }
}
