package com.lbs.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Statistical baseline for one (dimension value, metric, window) group")
public class BaselineStats {

    @Schema(description = "Dimension value the baseline describes", example = "310")
    String dimensionValue;

    @Schema(example = "SalesAmount")
    String metricName;

    @Schema(description = "Window the baseline covers", example = "2024-05-01..2024-05-30")
    String timeWindow;

    long count;
    double sum;
    double mean;

    @Schema(description = "Sample standard deviation; 0 for a single observation")
    double stddev;

    double min;
    double max;

    @Schema(description = "Linearly interpolated percentiles keyed p25, p50, p75, p95, p99")
    Map<String, Double> percentiles;

    @Schema(description = "True when count is below the minimum sample size; excluded from z-score/percentile detection")
    boolean insufficient;

    public double percentile(String key) {
        return percentiles == null ? Double.NaN : percentiles.getOrDefault(key, Double.NaN);
    }

    /**
     * Whether a z-score can be computed against this baseline at all. A zero-variance
     * group admits no anomaly.
     */
    public boolean supportsZScore() {
        return !insufficient && stddev > 0;
    }

    /** Returns the z-score, or {@code null} when the baseline cannot support one. */
    public Double zScore(double value) {
        return supportsZScore() ? (value - mean) / stddev : null;
    }
}
