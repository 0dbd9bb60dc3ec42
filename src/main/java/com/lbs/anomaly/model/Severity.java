package com.lbs.anomaly.model;

/**
 * Ordinal anomaly importance tier. Declaration order is the ranking.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
