package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Caller-supplied settings for one monitoring run. Not persisted by the engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Detection settings for a monitoring run")
public class DetectionConfig {

    @Schema(description = "Detection sensitivity", example = "medium")
    @Builder.Default
    private SensitivityLevel sensitivity = SensitivityLevel.MEDIUM;

    @Schema(description = "Days of history considered per subject", example = "30")
    @Builder.Default
    private int windowSizeDays = 30;

    @Schema(description = "Minutes between monitoring cycles", example = "15")
    @Builder.Default
    private int updateFrequencyMinutes = 15;

    @Schema(description = "Anomaly types to detect", example = "[\"performance\", \"usage\", \"market\", \"injury\"]")
    @Builder.Default
    private Set<AnomalyType> enabledTypes = EnumSet.of(
            AnomalyType.PERFORMANCE, AnomalyType.USAGE, AnomalyType.MARKET, AnomalyType.INJURY);

    public boolean isEnabled(AnomalyType type) {
        return enabledTypes != null && enabledTypes.contains(type);
    }
}
