package com.joinwatch.tracker.monitor.http;

public class TransientRemoteException extends RemoteCallException {
    public TransientRemoteException(PlatformStatus status, String message) {
        super(status, message);
    }
}
