package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

/**
 * Best-effort identity of the joining account. Every field except {@code synthetic} may be null.
 */
public record SubjectSnapshot(
    String username,
    String displayName,
    Instant accountCreatedAt,
    String avatarUrl,
    boolean bot,
    boolean system,
    boolean synthetic
) {
    public static SubjectSnapshot synthetic(String label) {
        return new SubjectSnapshot(label, label, null, null, false, false, true);
    }

    public static SubjectSnapshot of(String username, String displayName, Instant accountCreatedAt, String avatarUrl) {
        return new SubjectSnapshot(username, displayName, accountCreatedAt, avatarUrl, false, false, false);
    }

    public boolean hasUsername() {
        return username != null && !username.isBlank();
    }

    public String displayNameOrUsername() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return username;
    }
}
