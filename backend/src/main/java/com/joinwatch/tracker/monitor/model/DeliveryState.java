package com.joinwatch.tracker.monitor.model;

public enum DeliveryState {
    PENDING,
    RETRYING,
    SENT,
    FILTERED,
    FAILED;

    public boolean isTerminal() {
        return this == SENT || this == FILTERED || this == FAILED;
    }

    public boolean isDispatchable() {
        return this == PENDING || this == RETRYING;
    }
}
