package com.lbs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Predicted value for a future date; never flagged as an anomaly")
public record ForecastPoint(
        @Schema(example = "2024-07-01") String date,
        @Schema(example = "15234.5") double forecastedValue,
        @Schema(example = "12010.0") double lowerBound,
        @Schema(example = "18459.0") double upperBound,
        @Schema(example = "14890.2") double trend) {
}
