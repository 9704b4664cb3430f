package com.joinwatch.tracker.monitor.util;

import java.time.Instant;

public final class SnowflakeUtils {
    public static final long PLATFORM_EPOCH_MS = 1420070400000L;

    private SnowflakeUtils() {
    }

    public static boolean isSnowflake(String id) {
        if (id == null || id.isEmpty() || id.length() > 20) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return false;
            }
        }
        try {
            return Long.parseUnsignedLong(id) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Creation instant encoded in the upper bits of an account or message id, or null for non-numeric ids.
     */
    public static Instant creationTime(String id) {
        if (!isSnowflake(id)) {
            return null;
        }
        long value = Long.parseUnsignedLong(id);
        return Instant.ofEpochMilli((value >>> 22) + PLATFORM_EPOCH_MS);
    }
}
