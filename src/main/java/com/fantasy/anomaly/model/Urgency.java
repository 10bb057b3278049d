package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
    IMMEDIATE("immediate"),
    THIS_WEEK("this_week"),
    MONITOR("monitor");

    private final String value;

    Urgency(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Urgency forSeverity(Severity severity) {
        return severity == Severity.CRITICAL ? IMMEDIATE : THIS_WEEK;
    }

    @JsonCreator
    public static Urgency fromValue(String value) {
        for (Urgency urgency : values()) {
            if (urgency.value.equalsIgnoreCase(value) || urgency.name().equalsIgnoreCase(value)) {
                return urgency;
            }
        }
        throw new IllegalArgumentException("Unknown urgency: " + value);
    }
}
