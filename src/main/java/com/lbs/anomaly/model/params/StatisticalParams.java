package com.lbs.anomaly.model.params;

import com.lbs.anomaly.model.StatisticalMethod;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StatisticalParams implements DetectorParams {

    @Builder.Default
    StatisticalMethod method = StatisticalMethod.ZSCORE;

    @Builder.Default
    int lookbackDays = 365;

    // z-score cut-off
    @Builder.Default
    double threshold = 3.0;

    @Builder.Default
    double iqrMultiplier = 1.5;

    // groups with fewer source rows are dropped before detection
    @Builder.Default
    long minTransactions = 5;

    @Builder.Default
    int minSampleSize = 3;

    // isolation forest
    @Builder.Default
    double contamination = 0.1;

    @Builder.Default
    int numTrees = 100;

    @Builder.Default
    int sampleSize = 256;

    @Builder.Default
    long seed = 42L;

    @Builder.Default
    int minGroups = 10;

    @Builder.Default
    boolean useOrderCountFeature = true;
}
