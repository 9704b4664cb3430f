package com.joinwatch.tracker.monitor.model;

public enum AdmissionDecision {
    ADMITTED,
    DUPLICATE_NOTIFIED,
    DUPLICATE_TRACKED,
    STORE_UNAVAILABLE
}
