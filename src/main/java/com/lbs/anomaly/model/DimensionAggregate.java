package com.lbs.anomaly.model;

import java.util.Map;

/**
 * Metric aggregated over a lookback window for one dimension value.
 *
 * @param total            sum of the metric
 * @param observationCount number of source rows that contributed
 * @param orderCount       summed order count (secondary feature)
 */
public record DimensionAggregate(
        String dimensionKey,
        String dimensionLabel,
        double total,
        long observationCount,
        long orderCount,
        Map<String, String> attributes) {

    public DimensionAggregate {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
