package com.lbs.anomaly.model;

public enum SectionStatus {
    SUCCESS,
    FAILED,
    TIMED_OUT
}
