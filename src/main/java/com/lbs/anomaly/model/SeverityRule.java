package com.lbs.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Explicitly configured severity. A rule matches a record when every criterion it sets
 * matches; unset criteria match anything.
 */
@Value
@Builder
public class SeverityRule {

    String name;

    DetectorKind detectorKind;

    String detectorName;

    String dimensionValue;

    @Builder.Default
    double minAbsDeviationPct = 0.0;

    Severity severity;

    public boolean matches(AnomalyRecord record) {
        if (detectorKind != null && detectorKind != record.getDetectorKind()) return false;
        if (detectorName != null && !detectorName.equals(record.getDetectorSource())) return false;
        if (dimensionValue != null && !dimensionValue.equals(record.getDimensionValue())) return false;
        return record.absoluteDeviationPct() >= minAbsDeviationPct;
    }
}
