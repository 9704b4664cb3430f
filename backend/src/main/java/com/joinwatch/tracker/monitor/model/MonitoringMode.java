package com.joinwatch.tracker.monitor.model;

import java.util.Locale;

public enum MonitoringMode {
    EVENT_STREAM,
    HEURISTIC,
    BOTH;

    public boolean includesHeuristic() {
        return this == HEURISTIC || this == BOTH;
    }

    public boolean includesEventStream() {
        return this == EVENT_STREAM || this == BOTH;
    }

    public static MonitoringMode fromKey(String key) {
        if (key == null || key.isBlank()) {
            return HEURISTIC;
        }
        try {
            return MonitoringMode.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return HEURISTIC;
        }
    }
}
