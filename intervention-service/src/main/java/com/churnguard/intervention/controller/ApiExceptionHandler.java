package com.churnguard.intervention.controller;

import com.churnguard.common.exception.CycleInProgressException;
import com.churnguard.common.exception.InvalidConfigurationException;
import com.churnguard.intervention.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ApiError> handleInvalidConfiguration(InvalidConfigurationException ex) {
        log.warn("Configuration rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("invalid_configuration", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(CycleInProgressException.class)
    public ResponseEntity<ApiError> handleCycleInProgress(CycleInProgressException ex) {
        log.info("Manual run rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError("cycle_in_progress", ex.getMessage()));
    }
}
