package com.joinwatch.tracker.monitor.util;

import java.time.Instant;

/**
 * Subject ids for inferred joins without a known account. Real account ids are purely numeric,
 * so anything under the {@code placeholder:} prefix can never collide with one. Ids are bound to
 * the poll that saw the growth, never to a population value, which can repeat when members leave.
 */
public final class PlaceholderIds {
    public static final String PREFIX = "placeholder:";

    private PlaceholderIds() {
    }

    public static String forPopulationGrowth(String communityId, Instant observedAt, long index) {
        return PREFIX + communityId + ":count:" + observedAt.toEpochMilli() + ":" + index;
    }

    public static String forPresence(String communityId, Instant observedAt, long index) {
        return PREFIX + communityId + ":presence:" + observedAt.toEpochMilli() + ":" + index;
    }
}
