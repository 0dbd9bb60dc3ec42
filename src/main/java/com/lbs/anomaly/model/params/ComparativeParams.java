package com.lbs.anomaly.model.params;

import com.lbs.anomaly.model.ComparisonType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ComparativeParams implements DetectorParams {

    @Builder.Default
    ComparisonType comparisonType = ComparisonType.YOY;

    @Builder.Default
    double thresholdPct = 20.0;

    /** Pairs whose current value is below this floor are not flagged. */
    @Builder.Default
    double minValue = 0.0;

    @Builder.Default
    int lookbackDays = 1095;
}
