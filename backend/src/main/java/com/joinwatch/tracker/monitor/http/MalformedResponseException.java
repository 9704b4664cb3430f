package com.joinwatch.tracker.monitor.http;

public class MalformedResponseException extends RemoteCallException {
    public MalformedResponseException(String message) {
        super(PlatformStatus.MALFORMED, message);
    }
}
