package com.anomaly.alerting.store;

import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.domain.AnomalyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed alert store. Alerts live under {@code anomaly:alert:{id}} as JSON, cooldown
 * markers under {@code anomaly:cooldown:{metric}:{type}}; both expire on their own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "anomaly.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisAlertStore implements AlertStore {

    static final String ALERT_KEY_PREFIX = "anomaly:alert:";
    static final String COOLDOWN_KEY_PREFIX = "anomaly:cooldown:";

    private final RedisTemplate<String, AnomalyAlert> alertRedisTemplate;
    private final StringRedisTemplate stringRedisTemplate;

    @Override
    public Optional<AnomalyAlert> findById(String alertId) {
        return Optional.ofNullable(alertRedisTemplate.opsForValue().get(ALERT_KEY_PREFIX + alertId));
    }

    @Override
    public void save(AnomalyAlert alert, Duration ttl) {
        alertRedisTemplate.opsForValue().set(ALERT_KEY_PREFIX + alert.getId(), alert, ttl);
        log.debug("Stored alert {} ttl={}", alert.getId(), ttl);
    }

    @Override
    public List<AnomalyAlert> findAll() {
        Set<String> keys = alertRedisTemplate.keys(ALERT_KEY_PREFIX + "*");
        List<AnomalyAlert> alerts = new ArrayList<>();
        if (keys == null) return alerts;
        for (String key : keys) {
            try {
                AnomalyAlert alert = alertRedisTemplate.opsForValue().get(key);
                if (alert != null) alerts.add(alert);
            } catch (SerializationException e) {
                log.error("Skipping unreadable alert entry key={}. Entry may predate the current schema.", key, e);
            }
        }
        return alerts;
    }

    @Override
    public boolean isCoolingDown(String metric, AnomalyType type) {
        return Boolean.TRUE.equals(stringRedisTemplate.hasKey(cooldownKey(metric, type)));
    }

    @Override
    public void startCooldown(String metric, AnomalyType type, Duration ttl) {
        stringRedisTemplate.opsForValue().set(cooldownKey(metric, type), "1", ttl);
    }

    static String cooldownKey(String metric, AnomalyType type) {
        return COOLDOWN_KEY_PREFIX + metric + ":" + type.name();
    }
}
