package com.anomaly.alerting.api;

import com.anomaly.alerting.scheduler.DetectionScheduler;
import com.anomaly.alerting.scheduler.SweepStatusCache;
import com.anomaly.alerting.scheduler.SweepSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator controls for the detection sweep.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/anomalies/detection")
@RequiredArgsConstructor
@Tag(name = "Detection", description = "Run and inspect detection sweeps")
public class DetectionController {

    private final DetectionScheduler scheduler;
    private final SweepStatusCache statusCache;

    @PostMapping("/sweep")
    @Operation(summary = "Run a sweep now", description = "Runs one detection sweep synchronously; waits for any sweep already in progress.")
    public ResponseEntity<SweepSummary> sweep() {
        log.info("On-demand detection sweep requested");
        return ResponseEntity.ok(scheduler.runSweep());
    }

    @GetMapping("/status")
    @Operation(summary = "Last sweep summary", description = "204 when no sweep finished in the last 5 minutes.")
    public ResponseEntity<SweepSummary> status() {
        return statusCache.latest()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
