package com.lbs.anomaly.model.params;

import com.lbs.anomaly.model.Granularity;
import com.lbs.anomaly.model.TimeSeriesMode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TimeSeriesParams implements DetectorParams {

    /** Fewest days of history the forecast mode can fit trend and weekly seasonality on. */
    public static final int MIN_FORECAST_LOOKBACK_DAYS = 14;

    @Builder.Default
    TimeSeriesMode mode = TimeSeriesMode.MOVING_AVERAGE;

    @Builder.Default
    Granularity granularity = Granularity.DAILY;

    @Builder.Default
    int lookbackDays = 90;

    @Builder.Default
    int windowSize = 7;

    @Builder.Default
    double thresholdStd = 2.0;

    @Builder.Default
    int forecastDays = 30;

    /** Width of the forecast confidence interval, e.g. 0.95. */
    @Builder.Default
    double intervalWidth = 0.95;

    public boolean isForecast() {
        return mode == TimeSeriesMode.FORECAST;
    }

    public boolean hasYearlySeasonality() {
        return lookbackDays >= 365;
    }
}
