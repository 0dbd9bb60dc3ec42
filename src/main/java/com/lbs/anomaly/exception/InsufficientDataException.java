package com.lbs.anomaly.exception;

/**
 * Too few observations for the requested method.
 */
public class InsufficientDataException extends DetectionException {

    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_DATA";
    }
}
