package com.fantasy.anomaly.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The detectors known to the engine, with the anomaly types that switch each one on.
 * A detector runs only when at least one of its types is enabled. The trend detector
 * follows the metrics the statistical detector checks, so usage enables it too.
 */
public enum DetectorKind {
    STATISTICAL(EnumSet.of(AnomalyType.PERFORMANCE, AnomalyType.USAGE)),
    TREND(EnumSet.of(AnomalyType.PERFORMANCE, AnomalyType.USAGE)),
    PATTERN(EnumSet.of(AnomalyType.PERFORMANCE)),
    MARKET(EnumSet.of(AnomalyType.MARKET)),
    INJURY_RISK(EnumSet.of(AnomalyType.INJURY));

    private final Set<AnomalyType> types;

    DetectorKind(Set<AnomalyType> types) {
        this.types = types;
    }

    public Set<AnomalyType> getTypes() {
        return types;
    }

    public boolean isEnabled(Set<AnomalyType> enabledTypes) {
        return types.stream().anyMatch(enabledTypes::contains);
    }

    public static boolean hasDetectorFor(AnomalyType type) {
        for (DetectorKind kind : values()) {
            if (kind.types.contains(type)) {
                return true;
            }
        }
        return false;
    }
}
