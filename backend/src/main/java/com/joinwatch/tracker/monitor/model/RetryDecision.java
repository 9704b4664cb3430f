package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

public record RetryDecision(
    DeliveryState nextState,
    int attempts,
    Instant nextAttemptAt
) {
    public boolean isPermanent() {
        return nextState == DeliveryState.FAILED;
    }
}
