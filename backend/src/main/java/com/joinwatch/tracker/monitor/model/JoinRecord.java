package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

public record JoinRecord(
    long id,
    String subjectId,
    String communityId,
    String communityName,
    Instant observedAt,
    String source,
    Confidence confidence,
    SubjectSnapshot snapshot,
    DeliveryState deliveryState,
    int attempts,
    Instant nextAttemptAt,
    boolean notified,
    String lastError,
    Instant recordedAt
) {
}
