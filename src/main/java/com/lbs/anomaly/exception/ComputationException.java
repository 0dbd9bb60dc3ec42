package com.lbs.anomaly.exception;

/**
 * Unexpected numeric failure inside a detector.
 */
public class ComputationException extends DetectionException {

    public static final String ERROR_CODE = "COMPUTATION_ERROR";

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ComputationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
