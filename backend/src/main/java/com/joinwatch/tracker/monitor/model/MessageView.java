package com.joinwatch.tracker.monitor.model;

import java.time.Instant;

/**
 * Normalized view of a channel message, independent of the transport payload.
 */
public record MessageView(
    String id,
    int type,
    String content,
    String authorId,
    String authorUsername,
    String authorGlobalName,
    String authorAvatar,
    boolean authorBot,
    boolean authorSystem,
    Instant timestamp
) {
    public static final int DEFAULT = 0;
    public static final int MEMBER_JOIN = 7;

    public String contentOrEmpty() {
        return content == null ? "" : content;
    }
}
