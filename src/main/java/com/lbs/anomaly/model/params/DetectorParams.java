package com.lbs.anomaly.model.params;

/**
 * Marker for the strongly typed parameter set of a detector kind.
 */
public interface DetectorParams {

    /** Days of history the detector reads. */
    int getLookbackDays();
}
