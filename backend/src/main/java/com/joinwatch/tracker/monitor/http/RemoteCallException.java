package com.joinwatch.tracker.monitor.http;

public class RemoteCallException extends RuntimeException {
    private final PlatformStatus status;

    public RemoteCallException(PlatformStatus status, String message) {
        super(message);
        this.status = status;
    }

    public PlatformStatus getStatus() {
        return status;
    }
}
