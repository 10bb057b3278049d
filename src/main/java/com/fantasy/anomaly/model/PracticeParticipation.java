package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PracticeParticipation {
    FULL("full", 1.0),
    LIMITED("limited", 0.5),
    NONE("none", 0.0);

    private final String value;
    private final double score;

    PracticeParticipation(String value, double score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getScore() {
        return score;
    }

    @JsonCreator
    public static PracticeParticipation fromValue(String value) {
        for (PracticeParticipation p : values()) {
            if (p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown practice participation: " + value);
    }
}
