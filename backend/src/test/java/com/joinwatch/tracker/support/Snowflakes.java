package com.joinwatch.tracker.support;

import com.joinwatch.tracker.monitor.util.SnowflakeUtils;

import java.time.Instant;

public final class Snowflakes {
    private Snowflakes() {
    }

    /**
     * Builds an id whose embedded creation time is {@code createdAt}.
     */
    public static String idCreatedAt(Instant createdAt, int sequence) {
        long millis = createdAt.toEpochMilli() - SnowflakeUtils.PLATFORM_EPOCH_MS;
        return Long.toString((millis << 22) | (sequence & 0xFFF));
    }
}
