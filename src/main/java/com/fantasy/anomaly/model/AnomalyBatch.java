package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The complete output of one monitoring cycle. Only ever published whole.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies produced by one monitoring cycle")
public class AnomalyBatch {

    @Schema(description = "Monotonic cycle number", example = "42")
    private long cycleId;

    @Schema(description = "Cycle start (epoch millis)", example = "1760860800000")
    private long startedAt;

    @Schema(description = "Cycle end (epoch millis)", example = "1760860801250")
    private long completedAt;

    @Schema(description = "Number of subjects processed", example = "10")
    private int subjectCount;

    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    @Schema(description = "Subjects whose detection failed or was degraded this cycle")
    @Builder.Default
    private List<String> failedSubjects = new ArrayList<>();

    @Schema(description = "Alert keys resolved by reconciliation this cycle")
    @Builder.Default
    private List<String> resolvedAlertKeys = new ArrayList<>();

    @Schema(description = "Number of alerts purged by the retention pass", example = "0")
    private int purgedCount;
}
