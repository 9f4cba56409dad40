package com.anomaly.alerting.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Per-metric detection settings, keyed by metric name.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DetectionConfig {

    @NotBlank
    String metric;

    boolean enabled;

    /** 1-10; higher lowers every algorithm threshold. */
    @Min(1)
    @Max(10)
    int sensitivity;

    @NotNull
    @Singular
    List<@NotNull DetectionAlgorithm> algorithms;

    @Valid
    DetectionThresholds thresholds;

    @NotNull
    @Singular
    List<@NotNull AlertChannel> alertChannels;
}
