package com.joinwatch.tracker.monitor.model;

public record CommunityTarget(
    String id,
    String displayName,
    MonitoringMode monitoringMode,
    boolean excluded
) {
    public boolean isPolled() {
        return !excluded && monitoringMode != null && monitoringMode.includesHeuristic();
    }
}
