package com.anomaly.alerting.scheduler;

import com.anomaly.alerting.alert.AlertManager;
import com.anomaly.alerting.config.DetectionConfigStore;
import com.anomaly.alerting.detection.AnomalyDetector;
import com.anomaly.alerting.domain.Anomaly;
import com.anomaly.alerting.domain.DetectionConfig;
import com.anomaly.alerting.domain.TimeRange;
import com.anomaly.alerting.source.MetricSource;
import com.anomaly.alerting.source.MetricSourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic detection driver. One sweep runs immediately on start, then at a fixed rate on a
 * single thread so sweeps never overlap. On-demand sweeps share the same lock.
 * <p>
 * Each enabled metric is fetched, detected and alerted independently; a failure for one
 * metric is logged and only that metric is skipped. Such a metric counts as skipped only,
 * even if some of its alerts were raised before the failure.
 */
@Slf4j
@Component
public class DetectionScheduler implements SmartLifecycle {

    static final Duration HISTORY_WINDOW = Duration.ofDays(30);
    /** Detector history plus the newest point, which is evaluated as the current value. */
    static final int MIN_SERIES_POINTS = AnomalyDetector.MIN_HISTORY_POINTS + 1;

    private final DetectionConfigStore configStore;
    private final MetricSource metricSource;
    private final AnomalyDetector detector;
    private final AlertManager alertManager;
    private final SweepStatusCache statusCache;
    private final Clock clock;
    private final Duration interval;
    private final boolean autoStartup;

    private final Object sweepLock = new Object();
    private ThreadPoolTaskScheduler taskScheduler;
    private ScheduledFuture<?> scheduledSweep;
    private volatile boolean running;

    public DetectionScheduler(DetectionConfigStore configStore,
                              MetricSource metricSource,
                              AnomalyDetector detector,
                              AlertManager alertManager,
                              SweepStatusCache statusCache,
                              Clock clock,
                              @Value("${anomaly.scheduler.interval:60s}") Duration interval,
                              @Value("${anomaly.scheduler.enabled:true}") boolean autoStartup) {
        this.configStore = configStore;
        this.metricSource = metricSource;
        this.detector = detector;
        this.alertManager = alertManager;
        this.statusCache = statusCache;
        this.clock = clock;
        this.interval = interval;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("anomaly-sweep-");
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds(30);
        taskScheduler.initialize();
        scheduledSweep = taskScheduler.scheduleAtFixedRate(this::scheduledSweep, clock.instant(), interval);
        running = true;
        log.info("Anomaly detection started (interval={})", interval);
    }

    /** Cancels future sweeps; a sweep already in progress runs to completion. */
    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        scheduledSweep.cancel(false);
        taskScheduler.shutdown();
        log.info("Anomaly detection stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Runs one sweep over every enabled config on the calling thread.
     *
     * @throws RuntimeException if the configs cannot be loaded; per-metric failures never escape
     */
    public SweepSummary runSweep() {
        synchronized (sweepLock) {
            Instant startedAt = clock.instant();
            List<DetectionConfig> configs = configStore.getAll();
            int evaluated = 0;
            int skipped = 0;
            int anomaliesFound = 0;
            int alertsRaised = 0;

            for (DetectionConfig config : configs) {
                if (!config.isEnabled()) continue;
                try {
                    List<Double> series = metricSource.getHistory(config.getMetric(), TimeRange.ending(startedAt, HISTORY_WINDOW));
                    if (series.size() < MIN_SERIES_POINTS) {
                        log.debug("Skipping metric={}: {} points in the last {} days (need {})",
                                config.getMetric(), series.size(), HISTORY_WINDOW.toDays(), MIN_SERIES_POINTS);
                        skipped++;
                        continue;
                    }
                    double current = series.get(series.size() - 1);
                    List<Anomaly> anomalies = detector.detect(config, series.subList(0, series.size() - 1), current);
                    int raised = 0;
                    for (Anomaly anomaly : anomalies) {
                        if (alertManager.process(anomaly, config).isPresent()) {
                            raised++;
                        }
                    }
                    evaluated++;
                    anomaliesFound += anomalies.size();
                    alertsRaised += raised;
                } catch (MetricSourceUnavailableException e) {
                    log.warn("Skipping metric={}: {}", config.getMetric(), e.getMessage());
                    skipped++;
                } catch (Exception e) {
                    log.error("Detection failed for metric={}", config.getMetric(), e);
                    skipped++;
                }
            }

            SweepSummary summary = SweepSummary.builder()
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .metricsEvaluated(evaluated)
                    .metricsSkipped(skipped)
                    .anomaliesFound(anomaliesFound)
                    .alertsRaised(alertsRaised)
                    .build();
            statusCache.store(summary);
            log.info("Detection sweep finished: evaluated={}, skipped={}, anomalies={}, alerts={}",
                    evaluated, skipped, anomaliesFound, alertsRaised);
            return summary;
        }
    }

    private void scheduledSweep() {
        try {
            runSweep();
        } catch (Exception e) {
            log.error("Detection sweep failed", e);
        }
    }
}
