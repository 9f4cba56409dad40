package com.anomaly.alerting.store;

import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalyType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local alert store for single-instance runs and tests ({@code anomaly.store.type=memory}).
 * Expiry is evaluated lazily against the injected clock. Alerts are copied on the way in and
 * out so callers cannot mutate stored state without a save.
 */
@Component
@ConditionalOnProperty(name = "anomaly.store.type", havingValue = "memory")
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Expiring<AnomalyAlert>> alerts = new ConcurrentHashMap<>();
    private final Map<String, Instant> cooldowns = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAlertStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<AnomalyAlert> findById(String alertId) {
        Expiring<AnomalyAlert> entry = alerts.get(alertId);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            alerts.remove(alertId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value.toBuilder().build());
    }

    @Override
    public void save(AnomalyAlert alert, Duration ttl) {
        alerts.put(alert.getId(), new Expiring<>(alert.toBuilder().build(), clock.instant().plus(ttl)));
    }

    @Override
    public List<AnomalyAlert> findAll() {
        Instant now = clock.instant();
        alerts.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return alerts.values().stream()
                .map(e -> e.value.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public boolean isCoolingDown(String metric, AnomalyType type) {
        String key = RedisAlertStore.cooldownKey(metric, type);
        Instant expiresAt = cooldowns.get(key);
        if (expiresAt == null) return false;
        if (!clock.instant().isBefore(expiresAt)) {
            cooldowns.remove(key, expiresAt);
            return false;
        }
        return true;
    }

    @Override
    public void startCooldown(String metric, AnomalyType type, Duration ttl) {
        cooldowns.put(RedisAlertStore.cooldownKey(metric, type), clock.instant().plus(ttl));
    }

    private static final class Expiring<T> {
        private final T value;
        private final Instant expiresAt;

        private Expiring(T value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
