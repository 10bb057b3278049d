package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Detection sensitivity. The multiplier scales the z-score severity table used by
 * the statistical detector: a more sensitive setting lowers every threshold.
 */
public enum SensitivityLevel {
    LOW("low", 1.25),
    MEDIUM("medium", 1.0),
    HIGH("high", 0.8);

    private final String value;
    private final double thresholdMultiplier;

    SensitivityLevel(String value, double thresholdMultiplier) {
        this.value = value;
        this.thresholdMultiplier = thresholdMultiplier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    @JsonCreator
    public static SensitivityLevel fromValue(String value) {
        for (SensitivityLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity level: " + value);
    }
}
