package com.anomaly.alerting.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Statistical algorithms a {@link DetectionConfig} can enable. Serialized by key
 * ({@code zscore}, {@code iqr}, {@code mad}, {@code isolation_forest}).
 */
public enum DetectionAlgorithm {
    ZSCORE("zscore"),
    IQR("iqr"),
    MAD("mad"),
    /** Simplified isolation score: distance from the mean in units of 3σ, capped at 1. */
    ISOLATION_FOREST("isolation_forest");

    private final String key;

    DetectionAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolves an algorithm by key or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown name, so a bad config fails at load time
     */
    @JsonCreator
    public static DetectionAlgorithm fromKey(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (DetectionAlgorithm algorithm : values()) {
                if (algorithm.key.equalsIgnoreCase(normalized) || algorithm.name().equalsIgnoreCase(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detection algorithm '" + value + "'. Supported: "
                + Arrays.stream(values()).map(DetectionAlgorithm::getKey).collect(Collectors.joining(", ")));
    }
}
