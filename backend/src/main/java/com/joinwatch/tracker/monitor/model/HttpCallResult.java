package com.joinwatch.tracker.monitor.model;

import java.time.Duration;
import java.time.Instant;

public record HttpCallResult(
    String method,
    String url,
    int statusCode,
    String body,
    String retryAfterHeader,
    Instant completedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
