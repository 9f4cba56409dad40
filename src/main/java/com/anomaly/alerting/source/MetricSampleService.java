package com.anomaly.alerting.source;

import com.anomaly.alerting.persistence.entity.MetricSampleEntity;
import com.anomaly.alerting.persistence.repository.MetricSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Write side for daily samples: one value per (metric, day), later writes replace earlier ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricSampleService {

    private final MetricSampleRepository repository;

    @Transactional
    public MetricSampleEntity record(String metric, LocalDate date, double value) {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("Metric name is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Sample date is required");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite, got " + value);
        }
        MetricSampleEntity sample = repository.findByMetricNameAndSampleDate(metric, date)
                .orElseGet(() -> MetricSampleEntity.builder().metricName(metric).sampleDate(date).build());
        sample.setValue(value);
        MetricSampleEntity saved = repository.save(sample);
        log.debug("Recorded sample metric={} date={} value={}", metric, date, value);
        return saved;
    }
}
