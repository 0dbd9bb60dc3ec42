package com.lbs.anomaly.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * One observation of a metric for a dimension value on a business date.
 * {@code attributes} holds the remaining row columns (category, region, ...) used by
 * filters and passthrough columns.
 */
public record MetricPoint(
        String dimensionKey,
        String dimensionLabel,
        LocalDate timePeriod,
        String metricName,
        double value,
        long orderCount,
        Map<String, String> attributes) {

    public MetricPoint {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean isValid() {
        return timePeriod != null && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
