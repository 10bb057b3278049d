package com.fantasy.anomaly.service;

/**
 * The monitoring loop cannot start with the supplied configuration.
 */
public class MonitorConfigurationException extends RuntimeException {

    public MonitorConfigurationException(String message) {
        super(message);
    }
}
