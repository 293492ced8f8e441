package com.talentscout.discovery.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps discovery errors to JSON error bodies for the REST API
 */
@RestControllerAdvice(basePackages = "com.talentscout.discovery.controller")
@Slf4j
public class DiscoveryExceptionHandler {

    @ExceptionHandler(QueryBuildException.class)
    public ResponseEntity<Map<String, Object>> handleQueryBuildException(QueryBuildException ex) {
        log.warn("Rejected role attributes: {}", ex.getMessage());
        return error(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(NoUsableQueryException.class)
    public ResponseEntity<Map<String, Object>> handleNoUsableQueryException(NoUsableQueryException ex) {
        log.warn("No query could be built: {}", ex.getMessage());
        return error(ex.getErrorCode(), ex.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(DiscoveryConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationException(DiscoveryConfigurationException ex) {
        log.error("Discovery is misconfigured: {}", ex.getMessage());
        return error(ex.getErrorCode(), ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedInput(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return error("BUILDER_ERROR", "Malformed role attributes: " + ex.getReason(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DiscoveryException.class)
    public ResponseEntity<Map<String, Object>> handleDiscoveryException(DiscoveryException ex) {
        log.error("Discovery error: {}", ex.getMessage(), ex);
        return error(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error("INTERNAL_ERROR", "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Map<String, Object>> error(String errorCode, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
