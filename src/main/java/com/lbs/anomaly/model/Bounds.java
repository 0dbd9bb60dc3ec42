package com.lbs.anomaly.model;

public record Bounds(double lower, double upper) {

    public boolean isAbove(double value) {
        return value > upper;
    }

    public boolean isBelow(double value) {
        return value < lower;
    }

    public boolean contains(double value) {
        return !isAbove(value) && !isBelow(value);
    }
}
