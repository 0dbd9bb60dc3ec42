package com.lbs.anomaly.controller;

import com.lbs.anomaly.model.BaselineStats;
import com.lbs.anomaly.service.BaselineSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Daily per-dimension baseline statistics")
public class BaselineController {

    private final BaselineSnapshotService snapshotService;

    public BaselineController(BaselineSnapshotService snapshotService) {
        this.snapshotService = snapshotService;
    }

    @Operation(summary = "Baseline snapshot for a business date",
            description = "Returns the stored snapshot, computing it first when none exists.")
    @GetMapping
    public ResponseEntity<List<BaselineStats>> getSnapshot(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "ProductKey") String dimension,
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "100") int limit) {
        List<BaselineStats> stats = snapshotService.getOrCompute(date, dimension, metric);
        return ResponseEntity.ok(stats.size() > limit ? stats.subList(0, limit) : stats);
    }
}
