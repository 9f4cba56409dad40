package com.anomaly.alerting.persistence.repository;

import com.anomaly.alerting.persistence.entity.MetricSampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for daily metric samples.
 */
@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSampleEntity, Long> {

    Optional<MetricSampleEntity> findByMetricNameAndSampleDate(String metricName, LocalDate sampleDate);

    @Query("SELECT s FROM MetricSampleEntity s WHERE s.metricName = :metric " +
            "AND s.sampleDate >= :from AND s.sampleDate <= :to ORDER BY s.sampleDate ASC")
    List<MetricSampleEntity> findSeries(@Param("metric") String metric,
                                        @Param("from") LocalDate from,
                                        @Param("to") LocalDate to);
}
