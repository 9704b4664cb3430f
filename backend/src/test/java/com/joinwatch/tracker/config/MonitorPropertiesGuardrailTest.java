package com.joinwatch.tracker.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        MonitorProperties properties = new MonitorProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("join-watch/0.1"));
    }

    @Test
    void apiBaseUrlLosesTrailingSlashes() {
        MonitorProperties properties = new MonitorProperties();
        properties.setApiBaseUrl("http://localhost:9999/api//");
        assertEquals("http://localhost:9999/api", properties.getApiBaseUrl());
        properties.setApiBaseUrl(" ");
        assertEquals("https://discord.com/api/v10", properties.getApiBaseUrl());
    }

    @Test
    void dispatchAlwaysAllowsAtLeastOneRetry() {
        MonitorProperties properties = new MonitorProperties();
        properties.getDispatch().setMaxAttempts(1);
        properties.getDispatch().setRetryBackoffSeconds(List.of());
        assertEquals(2, properties.getDispatch().getMaxAttempts());
        assertEquals(List.of(30), properties.getDispatch().getRetryBackoffSeconds());
    }

    @Test
    void detectorLimitsAreClamped() {
        MonitorProperties properties = new MonitorProperties();
        properties.getDetector().setMessagesPerChannel(500);
        properties.getDetector().setPollIntervalSeconds(0);
        properties.getDedup().setWindowHours(-3);
        assertEquals(100, properties.getDetector().getMessagesPerChannel());
        assertEquals(1, properties.getDetector().getPollIntervalSeconds());
        assertEquals(1, properties.getDedup().getWindowHours());
    }
}
