package com.lbs.anomaly.model.params;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DayOnDayParams implements DetectorParams {

    @Builder.Default
    double thresholdPct = 20.0;

    @Builder.Default
    int lookbackDays = 30;

    @Builder.Default
    int topN = 50;

    /**
     * Display value reported as the percent change when the previous day was zero.
     * Stands in for an unbounded change.
     */
    @Builder.Default
    double zeroBaselineCapPct = 1000.0;
}
