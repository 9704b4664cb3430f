package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

public record DetectionBaseline(
    String communityId,
    String strategyName,
    String fieldName,
    Long lastValue,
    Instant updatedAt
) {
}
