package com.lbs.anomaly.exception;

/**
 * The metric store could not be read.
 */
public class DataUnavailableException extends DetectionException {

    public static final String ERROR_CODE = "DATA_UNAVAILABLE";

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public DataUnavailableException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
