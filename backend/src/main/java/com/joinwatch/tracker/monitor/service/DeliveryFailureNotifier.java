package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Surfaces permanently failed deliveries: always an ERROR log line, plus a best-effort notice
 * through the sink when error notices are enabled.
 */
@Component
public class DeliveryFailureNotifier {
    private static final Logger log = LoggerFactory.getLogger(DeliveryFailureNotifier.class);

    private final PlatformClient platformClient;
    private final JoinNotificationFormatter formatter;
    private final RateBudget rateBudget;
    private final MonitorProperties.Notifications notifications;

    public DeliveryFailureNotifier(
        PlatformClient platformClient,
        JoinNotificationFormatter formatter,
        RateBudget rateBudget,
        MonitorProperties properties
    ) {
        this.platformClient = platformClient;
        this.formatter = formatter;
        this.rateBudget = rateBudget;
        this.notifications = properties.getNotifications();
    }

    public void notifyPermanentFailure(JoinRecord record, int attempts, String reason) {
        log.error(
            "Giving up on join record {} ({} in {}) after {} attempt(s): {}",
            record.id(),
            record.subjectId(),
            record.communityId(),
            attempts,
            reason
        );
        String target = notifications.getTargetUserId();
        if (!notifications.isErrorNoticesEnabled() || target == null || target.isBlank()) {
            return;
        }
        if (!rateBudget.tryAcquire(Duration.ZERO)) {
            log.warn("Skipping failure notice for record {}: no send budget left", record.id());
            return;
        }
        PlatformResponse<String> response = platformClient.sendDirectMessage(
            target,
            formatter.formatFailureNotice(record, attempts, reason)
        );
        if (!response.isOk()) {
            log.warn("Failure notice for record {} was not delivered: {}", record.id(), response.status());
        }
    }
}
