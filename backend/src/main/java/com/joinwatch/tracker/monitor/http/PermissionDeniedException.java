package com.joinwatch.tracker.monitor.http;

public class PermissionDeniedException extends RemoteCallException {
    public PermissionDeniedException(PlatformStatus status, String message) {
        super(status, message);
    }
}
