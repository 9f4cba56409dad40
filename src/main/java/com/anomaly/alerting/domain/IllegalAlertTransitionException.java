package com.anomaly.alerting.domain;

/**
 * Thrown when a lifecycle transition is requested that the alert state machine does not allow
 * (any transition out of RESOLVED).
 */
public class IllegalAlertTransitionException extends RuntimeException {

    public IllegalAlertTransitionException(String message) {
        super(message);
    }
}
