package com.lbs.anomaly.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Copies configured passthrough attributes onto anomaly records. */
public final class AdditionalColumns {

    private AdditionalColumns() {}

    /** Returns null when no columns are configured, so the field stays out of the JSON. */
    public static Map<String, String> pick(List<String> columns, Map<String, String> attributes) {
        if (columns == null || columns.isEmpty()) return null;
        Map<String, String> picked = new LinkedHashMap<>();
        for (String column : columns) {
            picked.put(column, attributes.get(column));
        }
        return picked;
    }
}
