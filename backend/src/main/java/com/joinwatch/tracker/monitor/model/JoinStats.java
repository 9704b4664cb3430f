package com.joinwatch.tracker.monitor.model;

public record JoinStats(
    long totalJoins,
    long joins24h,
    long joins7d,
    long joins30d,
    long sent,
    long filtered,
    long failed,
    long pending
) {
}
