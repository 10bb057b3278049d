package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-ascending metric series for one subject. All arrays are parallel to
 * {@link #timestamps}. Owned by the provider; the engine never mutates it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recent per-game metric series for a subject")
public class SubjectMetrics {

    private String subjectId;

    @Builder.Default
    private List<Double> fantasyPoints = new ArrayList<>();

    @Builder.Default
    private List<Double> snapPercentage = new ArrayList<>();

    @Builder.Default
    private List<Double> targets = new ArrayList<>();

    @Builder.Default
    private List<Double> touches = new ArrayList<>();

    @Builder.Default
    private List<Double> redZoneUsage = new ArrayList<>();

    @Builder.Default
    private List<Double> efficiency = new ArrayList<>();

    @Builder.Default
    private List<Instant> timestamps = new ArrayList<>();

    /**
     * Returns a copy restricted to samples within {@code windowDays} of the latest
     * timestamp. Without timestamps the series is returned unchanged.
     */
    public SubjectMetrics window(int windowDays) {
        if (timestamps == null || timestamps.isEmpty()) {
            return this;
        }
        Instant latest = timestamps.get(timestamps.size() - 1);
        Instant cutoff = latest.minus(Duration.ofDays(windowDays));
        int from = 0;
        while (from < timestamps.size() && timestamps.get(from).isBefore(cutoff)) {
            from++;
        }
        if (from == 0) {
            return this;
        }
        int keep = timestamps.size() - from;
        return SubjectMetrics.builder()
                .subjectId(subjectId)
                .fantasyPoints(tail(fantasyPoints, keep))
                .snapPercentage(tail(snapPercentage, keep))
                .targets(tail(targets, keep))
                .touches(tail(touches, keep))
                .redZoneUsage(tail(redZoneUsage, keep))
                .efficiency(tail(efficiency, keep))
                .timestamps(new ArrayList<>(timestamps.subList(from, timestamps.size())))
                .build();
    }

    public List<Double> series(int slot) {
        return switch (slot) {
            case Baseline.SLOT_FANTASY_POINTS -> fantasyPoints;
            case Baseline.SLOT_SNAP_PERCENTAGE -> snapPercentage;
            case Baseline.SLOT_TARGETS -> targets;
            case Baseline.SLOT_TOUCHES -> touches;
            default -> throw new IllegalArgumentException("Unknown metric slot: " + slot);
        };
    }

    // Series are aligned on their latest sample, so keep the same trailing count.
    private static List<Double> tail(List<Double> values, int keep) {
        if (values == null) {
            return new ArrayList<>();
        }
        int start = Math.max(0, values.size() - keep);
        return new ArrayList<>(values.subList(start, values.size()));
    }
}
