package com.lbs.anomaly.controller;

import com.lbs.anomaly.model.CacheStats;
import com.lbs.anomaly.model.DetectorKind;
import com.lbs.anomaly.repository.DetectionCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Cache", description = "Detection result cache statistics and invalidation")
public class CacheController {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final DetectionCache cache;

    public CacheController(DetectionCache cache) {
        this.cache = cache;
    }

    @Operation(summary = "Cache hit/miss statistics")
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(cache.stats());
    }

    @Operation(summary = "Clear cached results", description = "Optionally only those of one detector kind.")
    @DeleteMapping
    public ResponseEntity<?> clear(@RequestParam(required = false) String detector) {
        String key = null;
        if (detector != null) {
            DetectorKind kind = DetectorKind.fromKey(detector);
            if (kind == null) {
                return ResponseEntity.badRequest().body(Map.of(
                        "error", "Unknown detector kind: " + detector,
                        "field", "detector"));
            }
            key = kind.key();
        }
        long removed = cache.clear(key);
        log.info("Cleared {} cached detection results ({})", removed, key == null ? "all" : key);
        return ResponseEntity.ok(Map.of("cleared", removed, "detector", key == null ? "all" : key));
    }
}
