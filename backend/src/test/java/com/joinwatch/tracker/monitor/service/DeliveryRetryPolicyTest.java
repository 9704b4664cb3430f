package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformStatus;
import com.joinwatch.tracker.monitor.model.DeliveryState;
import com.joinwatch.tracker.monitor.model.RetryDecision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryRetryPolicyTest {
    private static final Instant NOW = Instant.parse("2026-10-01T00:00:00Z");

    private DeliveryRetryPolicy policy(int maxAttempts, Integer... backoffSeconds) {
        MonitorProperties properties = new MonitorProperties();
        properties.getDispatch().setMaxAttempts(maxAttempts);
        properties.getDispatch().setRetryBackoffSeconds(List.of(backoffSeconds));
        return new DeliveryRetryPolicy(properties);
    }

    @Test
    void transientFailuresRetryWithGrowingBackoff() {
        DeliveryRetryPolicy policy = policy(4, 30, 120);

        RetryDecision first = policy.onFailure(1, PlatformStatus.TRANSIENT_ERROR, NOW);
        RetryDecision second = policy.onFailure(2, PlatformStatus.RATE_LIMITED, NOW);
        RetryDecision third = policy.onFailure(3, PlatformStatus.TRANSIENT_ERROR, NOW);

        assertEquals(DeliveryState.RETRYING, first.nextState());
        assertEquals(NOW.plusSeconds(30), first.nextAttemptAt());
        assertEquals(NOW.plusSeconds(120), second.nextAttemptAt());
        assertEquals(NOW.plusSeconds(120), third.nextAttemptAt());
    }

    @Test
    void exhaustedAttemptsFail() {
        RetryDecision decision = policy(3, 30).onFailure(3, PlatformStatus.TRANSIENT_ERROR, NOW);

        assertTrue(decision.isPermanent());
        assertEquals(3, decision.attempts());
        assertNull(decision.nextAttemptAt());
    }

    @Test
    void permanentStatusFailsImmediately() {
        DeliveryRetryPolicy policy = policy(5, 30);

        assertEquals(DeliveryState.FAILED, policy.onFailure(1, PlatformStatus.FORBIDDEN, NOW).nextState());
        assertEquals(DeliveryState.FAILED, policy.onFailure(1, PlatformStatus.NOT_FOUND, NOW).nextState());
    }

    @Test
    void backoffIndexIsClamped() {
        DeliveryRetryPolicy policy = policy(3, 5, 10, 20);

        assertEquals(Duration.ofSeconds(5), policy.backoffFor(0));
        assertEquals(Duration.ofSeconds(10), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(20), policy.backoffFor(99));
    }
}
