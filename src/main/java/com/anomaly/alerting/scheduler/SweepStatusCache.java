package com.anomaly.alerting.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Last sweep summary under {@code anomaly:last_detection} (5 min TTL), with the latest
 * summary of this instance kept in memory for when Redis is unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SweepStatusCache {

    static final String KEY = "anomaly:last_detection";
    static final Duration TTL = Duration.ofMinutes(5);

    private final RedisTemplate<String, SweepSummary> sweepSummaryRedisTemplate;

    private volatile SweepSummary lastLocal;

    public void store(SweepSummary summary) {
        lastLocal = summary;
        try {
            sweepSummaryRedisTemplate.opsForValue().set(KEY, summary, TTL);
        } catch (Exception e) {
            log.warn("Could not cache sweep summary: {}", e.getMessage());
        }
    }

    public Optional<SweepSummary> latest() {
        try {
            return Optional.ofNullable(sweepSummaryRedisTemplate.opsForValue().get(KEY));
        } catch (Exception e) {
            log.warn("Could not read cached sweep summary, using local copy: {}", e.getMessage());
            return Optional.ofNullable(lastLocal);
        }
    }
}
