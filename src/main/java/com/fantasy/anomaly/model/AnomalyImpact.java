package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Fantasy impact of an anomaly")
public class AnomalyImpact {

    @Schema(description = "Projected change in fantasy points", example = "24.0")
    double projectionDelta;

    @Schema(description = "Recommended roster action", example = "hold")
    RecommendedAction recommendedAction;

    @Schema(description = "How soon to act", example = "this_week")
    Urgency urgency;
}
