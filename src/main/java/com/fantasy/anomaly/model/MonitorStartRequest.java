package com.fantasy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Loop start request; omitted fields use the configured defaults")
public class MonitorStartRequest {

    private List<Subject> subjects;

    private DetectionConfig config;
}
