package com.joinwatch.tracker.monitor.model;

import java.util.Map;

public record CommunityInfo(
    String id,
    String name,
    Map<String, Long> populationCounts
) {
    public CommunityInfo {
        populationCounts = populationCounts == null ? Map.of() : Map.copyOf(populationCounts);
    }

    public Long count(String field) {
        return populationCounts.get(field);
    }
}
