package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.Baseline;

/**
 * Single metrics checked against the baseline by the statistical and trend detectors.
 */
public enum TrackedMetric {
    FANTASY_POINTS(AnomalyType.PERFORMANCE, Baseline.SLOT_FANTASY_POINTS, "Fantasy Points"),
    SNAP_PERCENTAGE(AnomalyType.USAGE, Baseline.SLOT_SNAP_PERCENTAGE, "Snap Percentage"),
    TARGET_SHARE(AnomalyType.USAGE, Baseline.SLOT_TARGETS, "Target Share");

    private final AnomalyType type;
    private final int slot;
    private final String displayName;

    TrackedMetric(AnomalyType type, int slot, String displayName) {
        this.type = type;
        this.slot = slot;
        this.displayName = displayName;
    }

    public AnomalyType getType() {
        return type;
    }

    public int getSlot() {
        return slot;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static TrackedMetric fromDisplayName(String name) {
        for (TrackedMetric metric : values()) {
            if (metric.displayName.equals(name)) {
                return metric;
            }
        }
        return null;
    }
}
