package com.joinwatch.tracker.monitor.model;

public enum Confidence {
    CONFIRMED,
    INFERRED
}
