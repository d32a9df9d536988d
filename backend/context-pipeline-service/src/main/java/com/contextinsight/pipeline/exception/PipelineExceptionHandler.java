package com.contextinsight.pipeline.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 파이프라인 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.contextinsight.pipeline.controller")
@Slf4j
public class PipelineExceptionHandler {

    @ExceptionHandler(StoreConflictException.class)
    public ResponseEntity<Map<String, Object>> handleStoreConflict(StoreConflictException ex) {
        log.error("Store conflict on {}: {}", ex.getLogicalKey(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        if ("CONFIG_ERROR".equals(ex.getErrorCode())) {
            log.warn("Invalid configuration: {}", ex.getMessage());
            return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
        }
        log.error("Pipeline error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        log.debug("Request rejected: {}", ex.getMessage());
        return respond(ex.getStatusCode(), "INVALID_REQUEST", ex.getReason() != null ? ex.getReason() : ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatusCode status, String errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("errorCode", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
