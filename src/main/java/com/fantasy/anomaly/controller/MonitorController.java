package com.fantasy.anomaly.controller;

import com.fantasy.anomaly.config.MonitorProperties;
import com.fantasy.anomaly.model.AnomalyBatch;
import com.fantasy.anomaly.model.DetectionConfig;
import com.fantasy.anomaly.model.MonitorStartRequest;
import com.fantasy.anomaly.model.MonitorStatus;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.service.MonitorConfigurationException;
import com.fantasy.anomaly.service.MonitoringLoopService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/monitor")
@Tag(name = "Monitoring Loop", description = "Start, stop and inspect the periodic anomaly monitoring loop")
public class MonitorController {

    private final MonitoringLoopService monitoringLoopService;
    private final MonitorProperties monitorProperties;

    public MonitorController(MonitoringLoopService monitoringLoopService,
                             MonitorProperties monitorProperties) {
        this.monitoringLoopService = monitoringLoopService;
        this.monitorProperties = monitorProperties;
    }

    @GetMapping
    @Operation(summary = "Get loop status",
               description = "Returns whether the loop is running, its configuration and the last published batch")
    public ResponseEntity<MonitorStatus> getStatus() {
        return ResponseEntity.ok(monitoringLoopService.getStatus());
    }

    @PostMapping("/start")
    @Operation(summary = "Start the monitoring loop",
               description = "Validates the configuration and schedules cycles. Omitted fields fall back to anomaly.monitor.* settings.")
    public ResponseEntity<?> start(@RequestBody(required = false) MonitorStartRequest request) {
        List<Subject> subjects = monitorProperties.getSubjects();
        DetectionConfig config = monitorProperties.toDetectionConfig();

        if (request != null) {
            if (request.getSubjects() != null) {
                subjects = request.getSubjects();
            }
            if (request.getConfig() != null) {
                config = request.getConfig();
            }
        }

        try {
            monitoringLoopService.start(subjects, config);
            return ResponseEntity.ok(monitoringLoopService.getStatus());
        } catch (MonitorConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the monitoring loop",
               description = "No further cycle starts; a cycle in progress completes and publishes")
    public ResponseEntity<MonitorStatus> stop() {
        monitoringLoopService.stop();
        return ResponseEntity.ok(monitoringLoopService.getStatus());
    }

    @PostMapping("/cycle")
    @Operation(summary = "Run one cycle now",
               description = "Runs an immediate monitoring cycle and returns its batch (for testing)")
    public ResponseEntity<?> runCycle() {
        try {
            Optional<AnomalyBatch> batch = monitoringLoopService.runCycleNow();
            if (batch.isEmpty()) {
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("error", "A monitoring cycle is already in progress");
                return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
            }
            return ResponseEntity.ok(batch.get());
        } catch (MonitorConfigurationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
