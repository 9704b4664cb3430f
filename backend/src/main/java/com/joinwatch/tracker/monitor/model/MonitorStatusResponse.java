package com.joinwatch.tracker.monitor.model;

import java.util.List;
import java.util.Map;

public record MonitorStatusResponse(
    boolean dbConnected,
    Map<String, Long> counts,
    JoinStats joinStats,
    boolean detectorRunning,
    int dispatchQueueDepth,
    List<CommunityPollStatus> communities
) {
}
