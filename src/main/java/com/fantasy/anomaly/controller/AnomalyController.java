package com.fantasy.anomaly.controller;

import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.service.AlertLifecycleService;
import com.fantasy.anomaly.service.AlertSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Active anomaly store: listing, lookup, manual resolution and purge")
public class AnomalyController {

    private final AlertLifecycleService alertLifecycleService;

    public AnomalyController(AlertLifecycleService alertLifecycleService) {
        this.alertLifecycleService = alertLifecycleService;
    }

    @GetMapping
    @Operation(summary = "List active anomalies",
               description = "Returns alerts from the active store, newest first, with resolved/unresolved counts. Supports filters.")
    public ResponseEntity<?> listAnomalies(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) String subjectId,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            AnomalyType typeFilter = type == null ? null : AnomalyType.fromValue(type);
            Severity severityFilter = severity == null ? null : Severity.fromValue(severity);

            List<ActiveAlert> alerts = alertLifecycleService.query(
                    typeFilter, severityFilter, resolved, subjectId, limit);
            AlertSummary summary = alertLifecycleService.summary();

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("count", alerts.size());
            response.put("total", summary.getTotal());
            response.put("resolved", summary.getResolved());
            response.put("unresolved", summary.getUnresolved());
            response.put("bySeverity", summary.getBySeverity());
            response.put("byType", summary.getByType());
            response.put("anomalies", alerts);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get an active anomaly",
               description = "Returns the alert whose current anomaly has this id")
    public ResponseEntity<ActiveAlert> getAnomaly(@PathVariable String anomalyId) {
        return alertLifecycleService.findById(anomalyId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{anomalyId}/resolve")
    @Operation(summary = "Resolve an anomaly manually",
               description = "Marks the alert resolved. It becomes active again if a later cycle re-detects it.")
    public ResponseEntity<ActiveAlert> resolveAnomaly(@PathVariable String anomalyId,
                                                      @RequestBody(required = false) Map<String, String> body) {
        String resolvedBy = body == null ? "ops" : body.getOrDefault("resolvedBy", "ops");
        Optional<ActiveAlert> resolved = alertLifecycleService.resolve(anomalyId, resolvedBy);
        return resolved.map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/purge")
    @Operation(summary = "Purge expired anomalies",
               description = "Removes every alert older than the retention window, resolved or not")
    public ResponseEntity<Map<String, Object>> purge() {
        int purged = alertLifecycleService.purge(Instant.now());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("purged", purged);
        response.put("remaining", alertLifecycleService.summary().getTotal());
        return ResponseEntity.ok(response);
    }
}
