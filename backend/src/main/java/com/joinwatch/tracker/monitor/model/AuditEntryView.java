package com.joinwatch.tracker.monitor.model;

public record AuditEntryView(
    String id,
    int actionType,
    String targetId
) {
}
