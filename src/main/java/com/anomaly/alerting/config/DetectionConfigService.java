package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.DetectionThresholds;
import com.anomaly.alerting.persistence.entity.DetectionConfigEntity;
import com.anomaly.alerting.persistence.repository.DetectionConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Detection configs with a Redis read-through cache ({@code anomaly:configs}, 1h) in front of
 * PostgreSQL. An empty table is seeded from {@link DetectionDefaultsProperties}.
 * <p>
 * Redis failures fail open to the database; database failures propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetectionConfigService implements DetectionConfigStore {

    static final String CACHE_KEY = "anomaly:configs";
    static final Duration CACHE_TTL = Duration.ofHours(1);

    private final RedisTemplate<String, DetectionConfigSnapshot> detectionConfigRedisTemplate;
    private final DetectionConfigRepository repository;
    private final DetectionDefaultsProperties defaults;
    private final DetectionConfigValidator validator;
    private final Clock clock;

    @Override
    @Transactional
    public List<DetectionConfig> getAll() {
        DetectionConfigSnapshot cached = readCache();
        if (cached != null) {
            return cached.getConfigs();
        }
        List<DetectionConfig> configs = loadFromDatabase();
        writeCache(configs);
        return configs;
    }

    @Override
    @Transactional
    public Optional<DetectionConfig> getByMetric(String metric) {
        return getAll().stream().filter(c -> c.getMetric().equals(metric)).findFirst();
    }

    @Override
    @Transactional
    public DetectionConfig upsert(DetectionConfig config) {
        validator.validate(config);
        seedIfEmpty();
        repository.save(toEntity(config));
        evictCache();
        log.info("[AUDIT] Detection config upserted: metric={}, enabled={}, sensitivity={}, algorithms={}",
                config.getMetric(), config.isEnabled(), config.getSensitivity(), config.getAlgorithms());
        return config;
    }

    private List<DetectionConfig> loadFromDatabase() {
        seedIfEmpty();
        List<DetectionConfig> configs = new ArrayList<>();
        for (DetectionConfigEntity entity : repository.findAllByOrderByMetricAsc()) {
            DetectionConfig config = toDomain(entity);
            validator.validate(config);
            configs.add(config);
        }
        log.debug("Loaded {} detection configs from database", configs.size());
        return configs;
    }

    private void seedIfEmpty() {
        if (repository.count() > 0) return;
        List<DetectionConfig> seed = defaults.toDetectionConfigs();
        seed.forEach(validator::validate);
        repository.saveAll(seed.stream().map(DetectionConfigService::toEntity).collect(Collectors.toList()));
        log.info("Seeded {} default detection configs", seed.size());
    }

    private DetectionConfigSnapshot readCache() {
        try {
            return detectionConfigRedisTemplate.opsForValue().get(CACHE_KEY);
        } catch (Exception e) {
            log.warn("Detection config cache read failed, falling back to database: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(List<DetectionConfig> configs) {
        try {
            DetectionConfigSnapshot snapshot = DetectionConfigSnapshot.builder()
                    .configs(configs)
                    .loadedAt(clock.instant())
                    .build();
            detectionConfigRedisTemplate.opsForValue().set(CACHE_KEY, snapshot, CACHE_TTL);
        } catch (Exception e) {
            log.warn("Detection config cache write failed: {}", e.getMessage());
        }
    }

    private void evictCache() {
        try {
            detectionConfigRedisTemplate.delete(CACHE_KEY);
        } catch (Exception e) {
            log.warn("Detection config cache eviction failed; cached configs may stay stale for up to {}: {}",
                    CACHE_TTL, e.getMessage());
        }
    }

    static DetectionConfigEntity toEntity(DetectionConfig config) {
        DetectionThresholds thresholds = config.getThresholds();
        return DetectionConfigEntity.builder()
                .metric(config.getMetric())
                .enabled(config.isEnabled())
                .sensitivity(config.getSensitivity())
                .algorithms(new ArrayList<>(config.getAlgorithms()))
                .thresholdMin(thresholds == null ? null : thresholds.getMin())
                .thresholdMax(thresholds == null ? null : thresholds.getMax())
                .alertChannels(new ArrayList<>(config.getAlertChannels()))
                .build();
    }

    static DetectionConfig toDomain(DetectionConfigEntity entity) {
        DetectionThresholds thresholds = entity.getThresholdMin() == null && entity.getThresholdMax() == null
                ? null
                : DetectionThresholds.builder().min(entity.getThresholdMin()).max(entity.getThresholdMax()).build();
        return DetectionConfig.builder()
                .metric(entity.getMetric())
                .enabled(entity.isEnabled())
                .sensitivity(entity.getSensitivity())
                .algorithms(entity.getAlgorithms())
                .thresholds(thresholds)
                .alertChannels(entity.getAlertChannels())
                .build();
    }
}
