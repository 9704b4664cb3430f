package com.joinwatch.tracker.monitor.model;

public record ChannelInfo(
    String id,
    String name,
    int type
) {
    public static final int TEXT = 0;

    public boolean isText() {
        return type == TEXT;
    }
}
