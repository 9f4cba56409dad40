package com.anomaly.alerting.store;

import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalyType;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Keyed TTL store for alerts and cooldown markers. Writes are last-writer-wins.
 * <p>
 * With more than one scheduler instance the backing store must be shared (Redis); a
 * process-local store would let each instance raise its own copy of every alert.
 */
public interface AlertStore {

    Optional<AnomalyAlert> findById(String alertId);

    /** Creates or overwrites the alert, resetting its expiry to {@code ttl}. */
    void save(AnomalyAlert alert, Duration ttl);

    /** Every unexpired alert, in no particular order. */
    List<AnomalyAlert> findAll();

    boolean isCoolingDown(String metric, AnomalyType type);

    void startCooldown(String metric, AnomalyType type, Duration ttl);
}
