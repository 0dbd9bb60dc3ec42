package com.lbs.anomaly.model;

/**
 * Direction of an anomaly. Time-series style detectors speak in spikes and drops,
 * period comparisons in increases and decreases; both vocabularies are kept in output.
 */
public enum AnomalyKind {
    SPIKE(true),
    DROP(false),
    INCREASE(true),
    DECREASE(false);

    private final boolean upward;

    AnomalyKind(boolean upward) {
        this.upward = upward;
    }

    public boolean isUpward() {
        return upward;
    }

    public static AnomalyKind ofDeviation(double signedDeviation) {
        return signedDeviation > 0 ? SPIKE : DROP;
    }

    public static AnomalyKind ofChange(double signedChange) {
        return signedChange > 0 ? INCREASE : DECREASE;
    }
}
