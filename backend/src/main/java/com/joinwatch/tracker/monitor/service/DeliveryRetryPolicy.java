package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformStatus;
import com.joinwatch.tracker.monitor.model.DeliveryState;
import com.joinwatch.tracker.monitor.model.RetryDecision;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Delivery state machine {@code PENDING -> RETRYING(n) -> ... -> FAILED} and the shared backoff table.
 */
@Component
public class DeliveryRetryPolicy {
    private final List<Duration> backoffSteps;
    private final int maxAttempts;

    public DeliveryRetryPolicy(MonitorProperties properties) {
        this.backoffSteps = properties.getDispatch().getRetryBackoffSeconds().stream()
            .map(seconds -> Duration.ofSeconds(Math.max(1, seconds)))
            .toList();
        this.maxAttempts = properties.getDispatch().getMaxAttempts();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempts number of attempts made so far, including the one that just failed
     */
    public RetryDecision onFailure(int attempts, PlatformStatus status, Instant now) {
        int safeAttempts = Math.max(1, attempts);
        if (status != null && status.isPermanent()) {
            return new RetryDecision(DeliveryState.FAILED, safeAttempts, null);
        }
        if (safeAttempts >= maxAttempts) {
            return new RetryDecision(DeliveryState.FAILED, safeAttempts, null);
        }
        return new RetryDecision(DeliveryState.RETRYING, safeAttempts, now.plus(backoffFor(safeAttempts)));
    }

    public Duration backoffFor(int failures) {
        int index = Math.max(0, Math.min(failures, backoffSteps.size()) - 1);
        return backoffSteps.get(index);
    }
}
