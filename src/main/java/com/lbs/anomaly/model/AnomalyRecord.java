package com.lbs.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Canonical anomaly produced by every detector. Detectors build it without severity and
 * description; the classifier returns an enriched copy. Instances are never mutated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "absoluteChange", allowGetters = true)
@Schema(description = "A single detected anomaly")
public class AnomalyRecord {

    @Schema(description = "Name of the detector configuration that produced the record", example = "daily_sales")
    String detectorSource;

    @Schema(example = "TIME_SERIES")
    DetectorKind detectorKind;

    @Schema(description = "Period the observation belongs to; null for cross-sectional detectors", example = "2024-05-14")
    String timePeriod;

    @Schema(description = "Period the observation was compared against (comparative/day-on-day)", example = "2024-05-13")
    String previousPeriod;

    @Schema(example = "ProductKey")
    String dimensionName;

    @Schema(example = "310")
    String dimensionValue;

    @Schema(description = "Display label of the dimension value", example = "Road-150 Red, 62")
    String dimensionLabel;

    @Schema(example = "SalesAmount")
    String metricName;

    @Schema(description = "Observed value", example = "48211.5")
    double metricValue;

    @Schema(description = "Value of the comparison period")
    Double previousValue;

    @Schema(description = "Baseline expectation (moving average, forecast, mean, median or previous period)")
    Double expectedValue;

    @Schema(description = "Acceptable range; present for band-based methods")
    Bounds bounds;

    @Schema(description = "Signed deviation from expectation in percent; positive means above", example = "64.2")
    Double deviationPct;

    @Schema(description = "Standardised distance from the baseline", example = "4.6")
    Double zscore;

    @Schema(description = "Isolation forest anomaly score in [0, 1]")
    Double anomalyScore;

    @Schema(description = "Trend component of the forecast model at this period")
    Double trend;

    @Schema(example = "SPIKE")
    AnomalyKind kind;

    @Schema(example = "HIGH")
    Severity severity;

    @Schema(example = "HIGH severity spike detected for ProductKey 'Road-150 Red, 62' on 2024-05-14. ...")
    String description;

    @Schema(description = "True when the previous value was zero and deviationPct holds the capped sentinel")
    boolean zeroBaseline;

    Long orderCount;

    Long previousOrderCount;

    @Schema(description = "Passthrough columns requested by the detector configuration")
    Map<String, String> additionalColumns;

    public double absoluteDeviationPct() {
        return deviationPct == null ? 0.0 : Math.abs(deviationPct);
    }

    @JsonProperty("absoluteChange")
    @Schema(description = "Current minus previous value (comparative/day-on-day)", example = "2000.0",
            accessMode = Schema.AccessMode.READ_ONLY)
    public Double absoluteChange() {
        return previousValue == null ? null : metricValue - previousValue;
    }
}
