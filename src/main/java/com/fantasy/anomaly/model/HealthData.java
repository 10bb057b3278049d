package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Practice, injury report and workload history for a subject")
public class HealthData {

    private String subjectId;

    @Schema(description = "Practice participation, oldest first", example = "[\"full\", \"limited\", \"none\"]")
    @Builder.Default
    private List<PracticeParticipation> practiceParticipation = new ArrayList<>();

    @Schema(description = "Injury report mentions", example = "[\"hamstring - questionable\"]")
    @Builder.Default
    private List<String> injuryReports = new ArrayList<>();

    @Schema(description = "Workload per session (snaps or touches)", example = "[58, 61, 64]")
    @Builder.Default
    private List<Double> workload = new ArrayList<>();

    @Schema(description = "Days of rest since the last game", example = "2")
    private int daysRest;

    public PracticeParticipation latestPractice() {
        if (practiceParticipation == null || practiceParticipation.isEmpty()) {
            return null;
        }
        return practiceParticipation.get(practiceParticipation.size() - 1);
    }
}
