package com.anomaly.alerting.domain;

/**
 * Thrown when a detection config fails validation on load or upsert. Handler returns HTTP 400.
 */
public class InvalidDetectionConfigException extends RuntimeException {

    public InvalidDetectionConfigException(String message) {
        super(message);
    }
}
