package com.fantasy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A single detected anomaly. Instances are immutable; correlation and alert
 * updates produce new instances through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Anomaly detected for a monitored subject")
public class Anomaly {

    @Schema(description = "Anomaly identifier", example = "performance_P-1001_fantasy-points_1760860800000")
    String id;

    @Schema(description = "Anomaly class", example = "performance")
    AnomalyType type;

    @Schema(description = "Severity classification", example = "medium")
    Severity severity;

    @Schema(description = "Detector confidence (0-1)", example = "0.4")
    double confidence;

    @Schema(description = "Monitored subject identifier", example = "P-1001")
    String subjectId;

    @Schema(description = "Display name of the subject", example = "J. Jefferson")
    String subjectName;

    @Schema(description = "Team of the subject, used for correlation", example = "MIN")
    String teamId;

    @Schema(description = "Human-readable summary", example = "Exceptional Fantasy Points")
    String description;

    AnomalyDetails details;

    AnomalyImpact impact;

    @Schema(description = "Detection time (ISO-8601)", example = "2026-10-19T08:00:00Z")
    Instant timestamp;

    @Schema(description = "Identifiers of correlated anomalies")
    @Builder.Default
    List<String> relatedAnomalyIds = List.of();
}
