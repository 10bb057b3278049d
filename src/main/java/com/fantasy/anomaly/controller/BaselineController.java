package com.fantasy.anomaly.controller;

import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Cached per-subject metric baselines")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @GetMapping("/{subjectId}")
    @Operation(summary = "Get a subject's baseline",
               description = "Returns the cached baseline; 404 until the subject has enough history")
    public ResponseEntity<Baseline> getBaseline(@PathVariable String subjectId) {
        return baselineService.find(subjectId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{subjectId}")
    @Operation(summary = "Invalidate a subject's baseline",
               description = "Drops the cached baseline so the next cycle recomputes it")
    public ResponseEntity<Map<String, Object>> invalidateBaseline(@PathVariable String subjectId) {
        boolean invalidated = baselineService.invalidate(subjectId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("subjectId", subjectId);
        response.put("invalidated", invalidated);
        return ResponseEntity.ok(response);
    }
}
