package com.lbs.anomaly.controller;

import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.model.DetectionReport;
import com.lbs.anomaly.model.DetectionResponse;
import com.lbs.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Validated
@Tag(name = "Anomalies", description = "Run configured or ad-hoc anomaly detectors")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Run detectors",
            description = "Runs every enabled detector, or those selected by `method`: a detector kind " +
                    "(time_series, statistical, comparative, day_on_day), `forecast`, or a configuration name.")
    @GetMapping("/all")
    public ResponseEntity<DetectionResponse> detectAll(
            @Parameter(description = "Detector selector", example = "all")
            @RequestParam(defaultValue = "all") String method) {
        return ResponseEntity.ok(detectionService.detect(method));
    }

    @Operation(summary = "Run one configured detector by name")
    @GetMapping("/configs/{name}")
    public ResponseEntity<DetectionReport> runConfigured(@PathVariable String name) {
        return detectionService.runConfigured(name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Moving-average time-series detection over the whole metric series")
    @GetMapping("/time-series")
    public ResponseEntity<DetectionReport> timeSeries(
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "daily") String granularity,
            @RequestParam(defaultValue = "90") @Min(1) @Max(3650) int lookbackDays,
            @RequestParam(defaultValue = "7") @Min(2) @Max(365) int windowSize,
            @RequestParam(defaultValue = "2.0") @DecimalMin(value = "0.0", inclusive = false) double thresholdStd,
            @Parameter(description = "Attribute filters as key=value", example = "category=Bikes")
            @RequestParam(required = false) List<String> filter) {
        return ResponseEntity.ok(detectionService.timeSeries(metric, granularity, lookbackDays, windowSize,
                thresholdStd, filters(filter)));
    }

    @Operation(summary = "Forecast-based detection with a forward projection",
            description = "Fits trend and weekly (plus yearly, from 365 days) seasonality. Needs at least 14 days.")
    @GetMapping("/forecast")
    public ResponseEntity<DetectionReport> forecast(
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "90") @Min(1) @Max(3650) int lookbackDays,
            @RequestParam(defaultValue = "30") @Min(0) @Max(365) int forecastDays,
            @RequestParam(defaultValue = "0.95") @DecimalMin("0.5") @DecimalMax("0.999") double intervalWidth,
            @RequestParam(required = false) List<String> filter) {
        return ResponseEntity.ok(detectionService.forecast(metric, lookbackDays, forecastDays, intervalWidth,
                filters(filter)));
    }

    @Operation(summary = "Cross-sectional outliers per dimension value",
            description = "method: zscore, iqr or isolation_forest")
    @GetMapping("/statistical")
    public ResponseEntity<DetectionReport> statistical(
            @RequestParam(defaultValue = "ProductKey") String dimension,
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "zscore") String method,
            @RequestParam(defaultValue = "365") @Min(1) @Max(3650) int lookbackDays,
            @RequestParam(defaultValue = "3.0") @DecimalMin(value = "0.0", inclusive = false) double threshold,
            @RequestParam(defaultValue = "5") @Min(0) long minTransactions,
            @RequestParam(defaultValue = "0.1") @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("0.5") double contamination,
            @RequestParam(required = false) List<String> filter) {
        return ResponseEntity.ok(detectionService.statistical(dimension, metric, method, lookbackDays, threshold,
                minTransactions, contamination, filters(filter)));
    }

    @Operation(summary = "Period-over-period comparison", description = "comparisonType: yoy, mom or qoq")
    @GetMapping("/comparative")
    public ResponseEntity<DetectionReport> comparative(
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "yoy") String comparisonType,
            @RequestParam(defaultValue = "20") @DecimalMin("0.0") double thresholdPct,
            @RequestParam(defaultValue = "0") double minValue,
            @RequestParam(defaultValue = "1095") @Min(1) @Max(3650) int lookbackDays,
            @RequestParam(required = false) List<String> filter) {
        return ResponseEntity.ok(detectionService.comparative(metric, comparisonType, thresholdPct, minValue,
                lookbackDays, filters(filter)));
    }

    @Operation(summary = "Day-over-day change for the top-N dimension values")
    @GetMapping("/day-on-day")
    public ResponseEntity<DetectionReport> dayOnDay(
            @RequestParam(defaultValue = "ProductKey") String dimension,
            @RequestParam(defaultValue = "SalesAmount") String metric,
            @RequestParam(defaultValue = "20") @DecimalMin("0.0") double thresholdPct,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int lookbackDays,
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int topN,
            @RequestParam(required = false) List<String> filter,
            @Parameter(description = "Attributes copied onto each anomaly", example = "category")
            @RequestParam(required = false) List<String> additionalColumn) {
        return ResponseEntity.ok(detectionService.dayOnDay(dimension, metric, thresholdPct, lookbackDays, topN,
                filters(filter), additionalColumn == null ? List.of() : additionalColumn));
    }

    static Map<String, String> filters(List<String> raw) {
        Map<String, String> filters = new LinkedHashMap<>();
        if (raw == null) return filters;
        for (String entry : raw) {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new ConfigurationException("filter '" + entry + "' must have the form key=value");
            }
            filters.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }
        return filters;
    }
}
