package com.lbs.anomaly.exception;

import java.util.List;

/**
 * Malformed or missing detector configuration. Raised while loading configuration or
 * while building an ad-hoc detector request.
 */
public class ConfigurationException extends DetectionException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Invalid detection configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String getErrorCode() {
        return "CONFIGURATION_ERROR";
    }
}
