package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

public record NotificationMarker(
    String subjectId,
    String communityId,
    Instant sentAt,
    long joinRecordId
) {
}
