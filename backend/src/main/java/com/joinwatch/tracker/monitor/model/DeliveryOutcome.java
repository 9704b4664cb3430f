package com.joinwatch.tracker.monitor.model;

public enum DeliveryOutcome {
    SENT,
    FILTERED,
    FAILED
}
