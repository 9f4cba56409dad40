package com.anomaly.alerting.persistence.entity;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.DetectionAlgorithm;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable copy of a metric's detection settings. The Redis cache is rebuilt from these rows.
 */
@Entity
@Table(name = "detection_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionConfigEntity {

    @Id
    @Column(name = "metric", nullable = false, length = 100)
    private String metric;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "sensitivity", nullable = false)
    private int sensitivity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "detection_config_algorithms", joinColumns = @JoinColumn(name = "metric"))
    @OrderColumn(name = "position")
    @Column(name = "algorithm", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private List<DetectionAlgorithm> algorithms = new ArrayList<>();

    @Column(name = "threshold_min")
    private Double thresholdMin;

    @Column(name = "threshold_max")
    private Double thresholdMax;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "detection_config_channels", joinColumns = @JoinColumn(name = "metric"))
    @OrderColumn(name = "position")
    @Column(name = "channel", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private List<AlertChannel> alertChannels = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
