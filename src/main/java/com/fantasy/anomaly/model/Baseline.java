package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Cached statistical summary of a subject's tracked metrics. Slot order is given by
 * the {@code SLOT_*} constants. Immutable: array accessors return copies.
 */
@Value
@Schema(description = "Per-subject metric baseline (mean / std / seasonal pattern)")
public class Baseline {

    public static final int SLOT_FANTASY_POINTS = 0;
    public static final int SLOT_SNAP_PERCENTAGE = 1;
    public static final int SLOT_TARGETS = 2;
    public static final int SLOT_TOUCHES = 3;
    public static final int TRACKED_METRICS = 4;

    @Schema(description = "Subject identifier", example = "P-1001")
    String subjectId;

    @Schema(description = "Mean per tracked metric", example = "[16.0, 72.5, 6.2, 14.0]")
    double[] mean;

    @Schema(description = "Standard deviation per tracked metric (never zero)", example = "[12.0, 4.1, 1.9, 3.3]")
    double[] std;

    @Schema(description = "Per-offset mean of fantasy points over the seasonal period (empty when history is shorter)")
    double[] seasonalPattern;

    @Schema(description = "Number of samples the baseline was computed from", example = "17")
    int sampleCount;

    @Schema(description = "Creation time (epoch millis)", example = "1760860800000")
    long createdAt;

    @Builder
    @Jacksonized
    public Baseline(String subjectId, double[] mean, double[] std, double[] seasonalPattern,
                    int sampleCount, long createdAt) {
        this.subjectId = subjectId;
        this.mean = copy(mean);
        this.std = copy(std);
        this.seasonalPattern = copy(seasonalPattern);
        this.sampleCount = sampleCount;
        this.createdAt = createdAt;
    }

    public double[] getMean() {
        return copy(mean);
    }

    public double[] getStd() {
        return copy(std);
    }

    public double[] getSeasonalPattern() {
        return copy(seasonalPattern);
    }

    public double meanAt(int slot) {
        return mean[slot];
    }

    public double stdAt(int slot) {
        return std[slot];
    }

    private static double[] copy(double[] values) {
        return values == null ? null : values.clone();
    }
}
