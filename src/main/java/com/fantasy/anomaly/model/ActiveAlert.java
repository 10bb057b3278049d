package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Entry of the active-anomaly store")
public class ActiveAlert {

    @Schema(description = "Deduplication key: subjectId:type:detector", example = "P-1001:performance:STATISTICAL")
    private String alertKey;

    @Schema(description = "Detector that raised the alert", example = "STATISTICAL")
    private DetectorKind detector;

    private Anomaly anomaly;

    @Schema(description = "Whether the triggering condition has cleared", example = "false")
    private boolean resolved;

    @Schema(description = "First detection time (epoch millis)", example = "1760860800000")
    private long firstDetectedAt;

    @Schema(description = "Resolution time (epoch millis), 0 while unresolved", example = "0")
    private long resolvedAt;

    @Schema(description = "How many cycles re-detected this alert", example = "3")
    @Builder.Default
    private int occurrences = 1;

    @Schema(description = "Who resolved the alert: reconciliation or an operator", example = "reconciliation")
    private String resolvedBy;
}
