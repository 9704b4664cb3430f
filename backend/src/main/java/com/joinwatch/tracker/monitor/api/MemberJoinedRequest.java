package com.joinwatch.tracker.monitor.api;

import java.time.Instant;

public record MemberJoinedRequest(
    String communityId,
    String subjectId,
    String username,
    String displayName,
    String avatarUrl,
    Instant accountCreatedAt,
    Boolean bot,
    Boolean system,
    Instant observedAt
) {
}
