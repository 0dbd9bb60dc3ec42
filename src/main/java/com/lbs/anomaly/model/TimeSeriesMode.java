package com.lbs.anomaly.model;

public enum TimeSeriesMode {
    MOVING_AVERAGE,
    FORECAST
}
