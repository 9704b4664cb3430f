package com.joinwatch.tracker.monitor.http;

public enum PlatformStatus {
    OK,
    NOT_FOUND,
    FORBIDDEN,
    RATE_LIMITED,
    TRANSIENT_ERROR,
    MALFORMED;

    public boolean isPermanent() {
        return this == NOT_FOUND || this == FORBIDDEN;
    }

    public boolean isRetryable() {
        return this == RATE_LIMITED || this == TRANSIENT_ERROR;
    }
}
