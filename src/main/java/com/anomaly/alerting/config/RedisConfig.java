package com.anomaly.alerting.config;

import com.anomaly.alerting.domain.AnomalyAlert;
import com.anomaly.alerting.scheduler.SweepSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Typed Redis templates for alerts, the detection config cache and the last sweep summary.
 * Each value type gets its own JSON serializer (ISO dates, no @class).
 */
@Configuration
public class RedisConfig {

    private static final ObjectMapper REDIS_MAPPER = JacksonRedisSerializer.redisObjectMapper();

    @Bean
    public RedisTemplate<String, AnomalyAlert> alertRedisTemplate(RedisConnectionFactory connectionFactory) {
        return jsonTemplate(connectionFactory, AnomalyAlert.class);
    }

    @Bean
    public RedisTemplate<String, DetectionConfigSnapshot> detectionConfigRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        return jsonTemplate(connectionFactory, DetectionConfigSnapshot.class);
    }

    @Bean
    public RedisTemplate<String, SweepSummary> sweepSummaryRedisTemplate(RedisConnectionFactory connectionFactory) {
        return jsonTemplate(connectionFactory, SweepSummary.class);
    }

    private static <T> RedisTemplate<String, T> jsonTemplate(RedisConnectionFactory connectionFactory, Class<T> type) {
        RedisTemplate<String, T> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        JacksonRedisSerializer<T> valueSerializer = new JacksonRedisSerializer<>(REDIS_MAPPER, type);
        template.setValueSerializer(valueSerializer);
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(valueSerializer);
        template.afterPropertiesSet();
        return template;
    }
}
