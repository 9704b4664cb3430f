package com.joinwatch.tracker.monitor.http;

import java.time.Duration;

public class RateLimitedException extends TransientRemoteException {
    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter, String message) {
        super(PlatformStatus.RATE_LIMITED, message);
        this.retryAfter = retryAfter;
    }

    /**
     * Server supplied wait, or null when the response carried no usable Retry-After.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
