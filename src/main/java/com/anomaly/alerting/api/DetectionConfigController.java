package com.anomaly.alerting.api;

import com.anomaly.alerting.config.DetectionConfigStore;
import com.anomaly.alerting.domain.DetectionConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies/configs")
@RequiredArgsConstructor
@Tag(name = "Detection configs", description = "Per-metric detection settings")
public class DetectionConfigController {

    private final DetectionConfigStore configStore;

    @GetMapping
    @Operation(summary = "List detection configs")
    public ResponseEntity<List<DetectionConfig>> getAll() {
        return ResponseEntity.ok(configStore.getAll());
    }

    @GetMapping("/{metric}")
    @Operation(summary = "Get a metric's detection config")
    public ResponseEntity<DetectionConfig> getByMetric(@PathVariable String metric) {
        return configStore.getByMetric(metric)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping
    @Operation(summary = "Create or replace a detection config",
            description = "Takes effect on the next sweep. Algorithms: zscore, iqr, mad, isolation_forest; sensitivity 1-10; thresholds.min must not exceed thresholds.max.")
    public ResponseEntity<DetectionConfig> upsert(@Valid @RequestBody DetectionConfig config) {
        return ResponseEntity.ok(configStore.upsert(config));
    }
}
