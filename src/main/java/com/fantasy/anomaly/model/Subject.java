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
@Schema(description = "A monitored entity (player)")
public class Subject {

    @Schema(description = "Subject identifier", example = "P-1001")
    private String id;

    @Schema(description = "Display name", example = "J. Jefferson")
    private String name;

    @Schema(description = "Team identifier", example = "MIN")
    private String teamId;
}
