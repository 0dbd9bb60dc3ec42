package com.lbs.anomaly.controller;

import com.lbs.anomaly.exception.ConfigurationException;
import com.lbs.anomaly.exception.DataUnavailableException;
import com.lbs.anomaly.exception.DetectionException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getProblems());
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), List.of());
    }

    @ExceptionHandler(DataUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(DataUnavailableException ex) {
        log.warn("Request failed, data source unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(DetectionException.class)
    public ResponseEntity<Map<String, Object>> handleDetection(DetectionException ex) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), List.of());
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String code, String message,
                                                      List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        if (!details.isEmpty()) body.put("details", details);
        return ResponseEntity.status(status).body(body);
    }
}
