package com.campaignhub.backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers
 *
 * Single-source failures never reach this point; they are absorbed during aggregation.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Every source failed - return 502 with the per-platform reasons
     */
    @ExceptionHandler(AllSourcesFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAllSourcesFailed(AllSourcesFailedException ex) {
        List<Map<String, Object>> failures = ex.getFailures().stream()
                .map(f -> Map.<String, Object>of(
                        "platform", f.getPlatform().getValue(),
                        "reason", f.getReason().name()))
                .toList();

        Map<String, Object> response = new HashMap<>();
        response.put("error", "ALL_SOURCES_FAILED");
        response.put("message", "No campaign source is currently available");
        response.put("failures", failures);
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));

        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(response);
    }

    /**
     * Handle invalid filter values
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "INVALID_REQUEST");
        response.put("message", ex.getMessage());
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(response);
    }

    /**
     * Handle generic exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        Map<String, Object> response = new HashMap<>();
        response.put("error", "INTERNAL_ERROR");
        response.put("message", "An unexpected error occurred");
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(response);
    }
}
