package com.lbs.anomaly.model;

import java.util.Locale;

public enum DetectorKind {
    TIME_SERIES("time_series"),
    STATISTICAL("statistical"),
    COMPARATIVE("comparative"),
    DAY_ON_DAY("day_on_day");

    private final String key;

    DetectorKind(String key) {
        this.key = key;
    }

    /** Snake-case name used in configuration and report keys. */
    public String key() {
        return key;
    }

    /** Accepts {@code day_on_day}, {@code day-on-day} and {@code dayonday} (relaxed map-key binding). */
    public static DetectorKind fromKey(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (DetectorKind kind : values()) {
            if (kind.key.replace("_", "").equals(normalized)) return kind;
        }
        return null;
    }
}
