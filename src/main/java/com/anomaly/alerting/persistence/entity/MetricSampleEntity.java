package com.anomaly.alerting.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One day-granular observation of a metric. At most one row per (metric, day).
 */
@Entity
@Table(name = "metric_samples",
        uniqueConstraints = @UniqueConstraint(name = "uk_metric_sample_day", columnNames = {"metric_name", "sample_date"}),
        indexes = @Index(name = "idx_metric_sample_lookup", columnList = "metric_name, sample_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "sample_date", nullable = false)
    private LocalDate sampleDate;

    @Column(name = "sample_value", nullable = false)
    private double value;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        recordedAt = Instant.now();
    }
}
