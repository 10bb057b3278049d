package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    PERFORMANCE("performance"),
    INJURY("injury"),
    USAGE("usage"),
    MARKET("market"),
    SOCIAL("social"),
    WEATHER("weather");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyType fromValue(String value) {
        for (AnomalyType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + value);
    }
}
