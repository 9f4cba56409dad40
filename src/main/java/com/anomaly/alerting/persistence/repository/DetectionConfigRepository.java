package com.anomaly.alerting.persistence.repository;

import com.anomaly.alerting.persistence.entity.DetectionConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DetectionConfigRepository extends JpaRepository<DetectionConfigEntity, String> {

    List<DetectionConfigEntity> findAllByOrderByMetricAsc();
}
