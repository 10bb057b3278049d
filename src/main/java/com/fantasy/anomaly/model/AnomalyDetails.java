package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Measured values behind an anomaly")
public class AnomalyDetails {

    @Schema(description = "Metric that deviated", example = "Fantasy Points")
    String metric;

    @Schema(description = "Baseline (expected) value", example = "16.0")
    double expectedValue;

    @Schema(description = "Observed value", example = "40.0")
    double actualValue;

    @Schema(description = "Deviation measure (z-score, rate or error depending on detector)", example = "2.0")
    double deviation;

    @Schema(description = "Context sentence for the deviation", example = "2.0 standard deviations from average")
    String historicalContext;
}
