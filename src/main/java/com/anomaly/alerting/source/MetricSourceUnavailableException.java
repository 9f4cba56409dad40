package com.anomaly.alerting.source;

/**
 * The metric store failed, timed out, or its circuit breaker is open.
 */
public class MetricSourceUnavailableException extends RuntimeException {

    public MetricSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
