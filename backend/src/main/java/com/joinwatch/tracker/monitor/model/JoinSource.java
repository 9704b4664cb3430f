package com.joinwatch.tracker.monitor.model;

/**
 * Where a join candidate came from: {@code event_stream} or {@code heuristic:<strategy>}.
 */
public record JoinSource(String value) {
    public static final JoinSource EVENT_STREAM = new JoinSource("event_stream");
    private static final String HEURISTIC_PREFIX = "heuristic:";

    public JoinSource {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("join source must not be blank");
        }
    }

    public static JoinSource heuristic(String strategyName) {
        return new JoinSource(HEURISTIC_PREFIX + strategyName);
    }

    public boolean isHeuristic() {
        return value.startsWith(HEURISTIC_PREFIX);
    }

    public String strategyName() {
        return isHeuristic() ? value.substring(HEURISTIC_PREFIX.length()) : null;
    }

    @Override
    public String toString() {
        return value;
    }
}
