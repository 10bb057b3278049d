package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendedAction {
    START("start"),
    BENCH("bench"),
    TRADE("trade"),
    PICKUP("pickup"),
    HOLD("hold"),
    MONITOR("monitor");

    private final String value;

    RecommendedAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RecommendedAction fromValue(String value) {
        for (RecommendedAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown recommended action: " + value);
    }
}
