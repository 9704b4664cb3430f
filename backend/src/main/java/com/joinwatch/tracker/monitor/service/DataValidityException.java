package com.joinwatch.tracker.monitor.service;

/**
 * The join record does not carry a notifiable identity. Never retried.
 */
public class DataValidityException extends RuntimeException {
    public DataValidityException(String message) {
        super(message);
    }
}
