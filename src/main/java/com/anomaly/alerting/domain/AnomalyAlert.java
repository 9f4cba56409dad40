package com.anomaly.alerting.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Operator-facing alert wrapping exactly one {@link Anomaly}. Lifecycle:
 * OPEN → ACKNOWLEDGED → RESOLVED, or OPEN → RESOLVED directly. RESOLVED is terminal;
 * alerts are never deleted, only expired from the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "state", allowGetters = true)
public class AnomalyAlert {

    /** Same as the wrapped anomaly id. */
    private String id;
    private Anomaly anomaly;
    private Instant alertedAt;

    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;

    private boolean resolved;
    private Instant resolvedAt;
    private String notes;

    public static AnomalyAlert open(Anomaly anomaly, Instant alertedAt) {
        return AnomalyAlert.builder()
                .id(anomaly.getId())
                .anomaly(anomaly)
                .alertedAt(alertedAt)
                .acknowledged(false)
                .resolved(false)
                .build();
    }

    public AlertState getState() {
        if (resolved) return AlertState.RESOLVED;
        if (acknowledged) return AlertState.ACKNOWLEDGED;
        return AlertState.OPEN;
    }

    /**
     * OPEN → ACKNOWLEDGED. Re-acknowledging overwrites who and when.
     *
     * @throws IllegalAlertTransitionException if the alert is already resolved
     */
    public void acknowledge(String by, Instant at) {
        if (resolved) {
            throw new IllegalAlertTransitionException("Alert " + id + " is resolved and cannot be acknowledged");
        }
        this.acknowledged = true;
        this.acknowledgedBy = by;
        this.acknowledgedAt = at;
    }

    /**
     * OPEN or ACKNOWLEDGED → RESOLVED. Resolving a resolved alert overwrites notes and timestamp.
     */
    public void resolve(String notes, Instant at) {
        this.resolved = true;
        this.resolvedAt = at;
        this.notes = notes;
    }
}
