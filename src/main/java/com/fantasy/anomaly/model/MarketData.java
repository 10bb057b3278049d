package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ownership and trade-activity signals for a subject")
public class MarketData {

    private String subjectId;

    @Schema(description = "Ownership percentage per sample", example = "[5.0, 5.0, 20.0]")
    @Builder.Default
    private List<Double> ownership = new ArrayList<>();

    @Schema(description = "Trade count per sample", example = "[50, 50, 50, 50, 50, 100, 350]")
    @Builder.Default
    private List<Double> tradeVolume = new ArrayList<>();

    @Builder.Default
    private List<Double> sentiment = new ArrayList<>();

    @Builder.Default
    private List<Instant> timestamps = new ArrayList<>();
}
