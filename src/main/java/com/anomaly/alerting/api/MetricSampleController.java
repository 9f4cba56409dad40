package com.anomaly.alerting.api;

import com.anomaly.alerting.persistence.entity.MetricSampleEntity;
import com.anomaly.alerting.source.MetricSampleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Minimal ingestion endpoint so the service can run without an upstream aggregation pipeline.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
@Tag(name = "Metrics", description = "Record daily metric samples")
public class MetricSampleController {

    private final MetricSampleService sampleService;

    @PostMapping("/{metric}/samples")
    @Operation(summary = "Record a daily sample", description = "Upserts the value for (metric, date).")
    public ResponseEntity<Map<String, Object>> record(@PathVariable String metric,
                                                      @Valid @RequestBody MetricSampleRequestDto dto) {
        MetricSampleEntity saved = sampleService.record(metric, dto.getDate(), dto.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "metric", saved.getMetricName(),
                "date", saved.getSampleDate().toString(),
                "value", saved.getValue()));
    }
}
