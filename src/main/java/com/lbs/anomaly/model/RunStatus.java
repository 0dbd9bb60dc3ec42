package com.lbs.anomaly.model;

public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    DISABLED
}
