package com.anomaly.alerting.source;

import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.persistence.entity.MetricSampleEntity;
import com.anomaly.alerting.persistence.repository.MetricSampleRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads daily samples from {@code metric_samples}. Every query runs through the
 * {@code metric-source} circuit breaker and is bounded by the JPA query timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMetricSource implements MetricSource {

    static final String CIRCUIT_BREAKER = "metric-source";

    private final MetricSampleRepository repository;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Override
    public List<Double> getHistory(String metric, TimeRange range) {
        LocalDate from = LocalDate.ofInstant(range.getStart(), ZoneOffset.UTC);
        LocalDate to = LocalDate.ofInstant(range.getEnd(), ZoneOffset.UTC);
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        try {
            List<MetricSampleEntity> samples = cb.executeSupplier(() -> repository.findSeries(metric, from, to));
            log.debug("Fetched {} samples for metric={} between {} and {}", samples.size(), metric, from, to);
            return samples.stream().map(MetricSampleEntity::getValue).collect(Collectors.toList());
        } catch (CallNotPermittedException e) {
            throw new MetricSourceUnavailableException("Circuit open for metric source; skipped metric " + metric, e);
        } catch (DataAccessException e) {
            throw new MetricSourceUnavailableException("Metric history query failed for metric " + metric, e);
        }
    }
}
