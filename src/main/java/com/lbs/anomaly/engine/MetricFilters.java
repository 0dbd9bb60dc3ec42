package com.lbs.anomaly.engine;

import com.lbs.anomaly.model.MetricPoint;

import java.util.Arrays;
import java.util.Map;

/**
 * Attribute predicates from detector configuration. A filter value may list alternatives
 * separated by {@code |}; a point matches when every filter matches one alternative.
 */
public final class MetricFilters {

    private MetricFilters() {}

    public static boolean matches(MetricPoint point, Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) return true;
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            if (!matchesValue(valueOf(point, filter.getKey()), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static String valueOf(MetricPoint point, String attribute) {
        if ("dimension_key".equals(attribute)) return point.dimensionKey();
        return point.attribute(attribute);
    }

    private static boolean matchesValue(String actual, String expected) {
        if (actual == null) return false;
        return Arrays.stream(expected.split("\\|"))
                .map(String::trim)
                .anyMatch(actual::equals);
    }
}
