package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.monitor.model.CommunityPollStatus;
import com.joinwatch.tracker.monitor.model.DetectionBaseline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-community baselines and liveness stamps. Owned by exactly one poll task, so it is not
 * thread-safe; {@link #snapshot(String)} is the only method meant for other threads.
 */
public class DetectionState {
    private final String communityId;
    private final Instant createdAt;
    private final Map<String, Long> baselines = new LinkedHashMap<>();
    private final Set<String> dirtyKeys = new LinkedHashSet<>();
    private volatile Instant lastSignalAt;
    private volatile Instant lastHeartbeatAt;
    private volatile Instant lastPollAt;
    private volatile long pollCount;
    private volatile int lastCandidateCount;

    public DetectionState(String communityId, Instant createdAt) {
        this.communityId = communityId;
        this.createdAt = createdAt;
    }

    public static DetectionState restore(String communityId, Instant now, List<DetectionBaseline> rows) {
        DetectionState state = new DetectionState(communityId, now);
        if (rows != null) {
            for (DetectionBaseline row : rows) {
                state.baselines.put(key(row.strategyName(), row.fieldName()), row.lastValue());
            }
        }
        return state;
    }

    public String getCommunityId() {
        return communityId;
    }

    public Long baseline(String strategyName, String fieldName) {
        return baselines.get(key(strategyName, fieldName));
    }

    public void updateBaseline(String strategyName, String fieldName, Long value) {
        String key = key(strategyName, fieldName);
        baselines.put(key, value);
        dirtyKeys.add(key);
    }

    /**
     * Returns and clears the baselines changed since the last call.
     */
    public List<DetectionBaseline> drainDirty(Instant now) {
        List<DetectionBaseline> changed = new ArrayList<>();
        for (String key : dirtyKeys) {
            int split = key.indexOf('|');
            changed.add(new DetectionBaseline(
                communityId,
                key.substring(0, split),
                key.substring(split + 1),
                baselines.get(key),
                now
            ));
        }
        dirtyKeys.clear();
        return changed;
    }

    public void recordPoll(Instant now, int candidateCount) {
        lastPollAt = now;
        pollCount++;
        lastCandidateCount = candidateCount;
        if (candidateCount > 0) {
            lastSignalAt = now;
        }
    }

    /**
     * Most recent of signal, heartbeat or creation time; the reference point for staleness.
     */
    public Instant lastLivenessAt() {
        Instant latest = createdAt;
        if (lastSignalAt != null && lastSignalAt.isAfter(latest)) {
            latest = lastSignalAt;
        }
        if (lastHeartbeatAt != null && lastHeartbeatAt.isAfter(latest)) {
            latest = lastHeartbeatAt;
        }
        return latest;
    }

    public void markHeartbeat(Instant now) {
        lastHeartbeatAt = now;
    }

    public Instant getLastSignalAt() {
        return lastSignalAt;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public Instant getLastPollAt() {
        return lastPollAt;
    }

    public long getPollCount() {
        return pollCount;
    }

    public CommunityPollStatus snapshot(String displayName) {
        return new CommunityPollStatus(
            communityId,
            displayName,
            pollCount,
            lastPollAt,
            lastSignalAt,
            lastHeartbeatAt,
            lastCandidateCount
        );
    }

    private static String key(String strategyName, String fieldName) {
        return strategyName + "|" + fieldName;
    }
}
