package com.newsdigest.backend.exception;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRunNotFound(RunNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "Run not found", e.getMessage());
    }

    @ExceptionHandler(IllegalRunTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalTransition(IllegalRunTransitionException e) {
        log.warn("⚠️ Rejected run transition: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "Illegal run transition", e.getMessage());
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidConfiguration(InvalidConfigurationException e) {
        log.warn("⚠️ Invalid configuration: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid configuration", e.getMessage());
    }

    @ExceptionHandler(DataIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleDataIntegrity(DataIntegrityException e) {
        return body(HttpStatus.BAD_REQUEST, "Invalid candidate field: " + e.getField(), e.getMessage());
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStateStore(StateStoreException e) {
        log.error("💥 State store failure: {}", e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "State store unavailable", e.getMessage());
    }

    @ExceptionHandler(NewsDigestException.class)
    public ResponseEntity<Map<String, Object>> handleNewsDigest(NewsDigestException e) {
        log.error("❌ Request failed: {}", e.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Request failed", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "Bad request", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message != null ? message : "",
                "timestamp", System.currentTimeMillis()
        ));
    }
}
