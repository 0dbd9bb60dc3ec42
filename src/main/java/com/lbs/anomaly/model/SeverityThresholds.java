package com.lbs.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Severity cut-offs for one detector kind. Deviations are absolute percentages.
 */
@Value
@Builder(toBuilder = true)
public class SeverityThresholds {

    @Builder.Default
    double criticalPct = 100.0;

    @Builder.Default
    double highPct = 50.0;

    @Builder.Default
    double highZ = 4.0;

    /** Below this deviation a low-tier detector reports LOW instead of MEDIUM. */
    @Builder.Default
    double mediumPct = 30.0;

    @Builder.Default
    boolean lowTierEnabled = false;
}
