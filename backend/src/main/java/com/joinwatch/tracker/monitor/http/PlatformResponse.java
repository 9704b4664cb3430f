package com.joinwatch.tracker.monitor.http;

import java.time.Duration;

/**
 * Outcome of one platform call. {@code retryAfter} is only set for {@link PlatformStatus#RATE_LIMITED}.
 */
public record PlatformResponse<T>(
    PlatformStatus status,
    T payload,
    int httpStatus,
    Duration retryAfter,
    String message
) {
    public static <T> PlatformResponse<T> ok(T payload, int httpStatus) {
        return new PlatformResponse<>(PlatformStatus.OK, payload, httpStatus, null, null);
    }

    public static <T> PlatformResponse<T> failure(PlatformStatus status, int httpStatus, String message) {
        return new PlatformResponse<>(status, null, httpStatus, null, message);
    }

    public static <T> PlatformResponse<T> rateLimited(int httpStatus, Duration retryAfter, String message) {
        return new PlatformResponse<>(PlatformStatus.RATE_LIMITED, null, httpStatus, retryAfter, message);
    }

    public boolean isOk() {
        return status == PlatformStatus.OK;
    }

    public T payloadOrThrow() {
        return switch (status) {
            case OK -> payload;
            case NOT_FOUND, FORBIDDEN -> throw new PermissionDeniedException(status, describe());
            case RATE_LIMITED -> throw new RateLimitedException(retryAfter, describe());
            case TRANSIENT_ERROR -> throw new TransientRemoteException(status, describe());
            case MALFORMED -> throw new MalformedResponseException(describe());
        };
    }

    private String describe() {
        String detail = message == null || message.isBlank() ? "no detail" : message;
        return status + " (http " + httpStatus + "): " + detail;
    }
}
