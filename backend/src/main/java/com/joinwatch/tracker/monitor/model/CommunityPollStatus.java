package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

public record CommunityPollStatus(
    String communityId,
    String displayName,
    long pollCount,
    Instant lastPollAt,
    Instant lastSignalAt,
    Instant lastHeartbeatAt,
    int lastCandidateCount
) {
}
