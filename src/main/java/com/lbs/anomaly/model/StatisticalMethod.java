package com.lbs.anomaly.model;

public enum StatisticalMethod {
    ZSCORE,
    IQR,
    ISOLATION_FOREST
}
