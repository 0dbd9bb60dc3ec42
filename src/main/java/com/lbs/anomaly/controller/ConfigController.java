package com.lbs.anomaly.controller;

import com.lbs.anomaly.config.DetectionProperties;
import com.lbs.anomaly.model.DetectionConfig;
import com.lbs.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Active detector configuration")
public class ConfigController {

    private final AnomalyDetectionService detectionService;
    private final DetectionProperties properties;

    public ConfigController(AnomalyDetectionService detectionService, DetectionProperties properties) {
        this.detectionService = detectionService;
        this.properties = properties;
    }

    @Operation(summary = "List detector configurations", description = "Validated at startup; read-only.")
    @GetMapping("/detections")
    public ResponseEntity<List<DetectionConfig>> getDetections() {
        return ResponseEntity.ok(detectionService.listConfigs());
    }

    @Operation(summary = "Severity, cache and execution settings")
    @GetMapping("/engine")
    public ResponseEntity<Map<String, Object>> getEngineSettings() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", properties.isEnabled());
        body.put("severity", properties.getSeverity());
        body.put("customRules", properties.getCustomRules());
        body.put("cache", properties.getCache());
        body.put("execution", properties.getExecution());
        body.put("snapshot", properties.getSnapshot());
        return ResponseEntity.ok(body);
    }
}
