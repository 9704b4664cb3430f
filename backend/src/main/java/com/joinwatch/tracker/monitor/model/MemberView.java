package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

/**
 * A community member or bare user account. {@code joinedAt} is null when the source does not
 * carry membership data.
 */
public record MemberView(
    String userId,
    String username,
    String globalName,
    String avatar,
    boolean bot,
    boolean system,
    Instant joinedAt
) {
}
