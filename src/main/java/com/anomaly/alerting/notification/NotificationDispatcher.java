package com.anomaly.alerting.notification;

import com.anomaly.alerting.domain.AlertChannel;
import com.anomaly.alerting.domain.AnomalyAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort fan-out of an alert to its configured channels. Channels run concurrently on a
 * bounded pool, each with its own timeout; one slow or failing channel never affects another
 * and nothing is retried. Always returns an outcome for every requested channel.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final Map<AlertChannel, NotificationSender> senders;
    private final ExecutorService executor;
    private final long timeoutMs;

    public NotificationDispatcher(List<NotificationSender> senders,
                                  @Qualifier("notificationExecutor") ExecutorService executor,
                                  @Value("${anomaly.notification.timeout-ms:5000}") long timeoutMs) {
        this.senders = new EnumMap<>(AlertChannel.class);
        for (NotificationSender sender : senders) {
            this.senders.put(sender.channel(), sender);
        }
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    public Map<AlertChannel, DeliveryStatus> dispatch(AnomalyAlert alert, List<AlertChannel> channels) {
        Map<AlertChannel, CompletableFuture<DeliveryStatus>> pending = new EnumMap<>(AlertChannel.class);
        for (AlertChannel channel : new LinkedHashSet<>(channels)) {
            pending.put(channel, deliver(channel, alert));
        }

        Map<AlertChannel, DeliveryStatus> outcomes = new EnumMap<>(AlertChannel.class);
        pending.forEach((channel, future) -> outcomes.put(channel, future.join()));
        return outcomes;
    }

    private CompletableFuture<DeliveryStatus> deliver(AlertChannel channel, AnomalyAlert alert) {
        NotificationSender sender = senders.get(channel);
        if (sender == null) {
            log.warn("No sender registered for channel {}; alert {} not delivered there", channel, alert.getId());
            return CompletableFuture.completedFuture(DeliveryStatus.SKIPPED);
        }
        try {
            return CompletableFuture.runAsync(() -> sender.send(alert), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .handle((ignored, ex) -> outcome(channel, alert, ex));
        } catch (Exception e) {
            log.error("Could not schedule {} delivery for alert {}", channel, alert.getId(), e);
            return CompletableFuture.completedFuture(DeliveryStatus.FAILED);
        }
    }

    private static DeliveryStatus outcome(AlertChannel channel, AnomalyAlert alert, Throwable ex) {
        if (ex == null) {
            log.debug("Delivered alert {} via {}", alert.getId(), channel);
            return DeliveryStatus.DELIVERED;
        }
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            log.error("Delivery of alert {} via {} timed out", alert.getId(), channel);
            return DeliveryStatus.TIMED_OUT;
        }
        log.error("Delivery of alert {} via {} failed", alert.getId(), channel, cause);
        return DeliveryStatus.FAILED;
    }
}
