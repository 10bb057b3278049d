package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Monitoring loop state")
public class MonitorStatus {

    @Schema(description = "Whether cycles are scheduled", example = "true")
    private boolean running;

    @Schema(description = "Whether a cycle is executing right now", example = "false")
    private boolean cycleInProgress;

    @Schema(description = "Subjects monitored per cycle", example = "10")
    private int subjectCount;

    private DetectionConfig config;

    @Schema(description = "Cycles completed since startup", example = "12")
    private long cyclesCompleted;

    @Schema(description = "Ticks skipped because a cycle was still running", example = "0")
    private long skippedTicks;

    @Schema(description = "Loop start time (epoch millis), 0 if never started", example = "1760860800000")
    private long startedAt;

    private AnomalyBatch lastBatch;
}
