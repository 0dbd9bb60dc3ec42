package com.lbs.anomaly.exception;

/**
 * Base class of the detection error taxonomy. The error code is surfaced in failed
 * report sections and API error bodies.
 */
public abstract class DetectionException extends RuntimeException {

    protected DetectionException(String message) {
        super(message);
    }

    protected DetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
}
