package com.example.abac.common.exception;

import com.example.abac.exception.AbacException;
import com.example.abac.exception.PolicyStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Typed decision point errors map to their own status and code; everything else is reported
 * without internal detail.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Limits for log sanitization
    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 200;

    /**
     * Handles typed decision point errors.
     *
     * @param ex the exception
     * @return error response carrying the exception's code
     */
    @ExceptionHandler(AbacException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAbacException(@NonNull AbacException ex) {
        if (ex instanceof PolicyStoreUnavailableException) {
            LOG.error("{}: {}", ex.getCode(), sanitizeForLog(ex.getMessage()), ex);
        } else {
            LOG.warn("{}: {}", ex.getCode(), sanitizeForLog(ex.getMessage()));
        }
        return ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getCode().toLowerCase(Locale.ROOT),
                        "code", ex.getCode(),
                        "message", sanitizeResponseMessage(ex.getMessage()),
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     *
     * @param ex the exception
     * @return error response with field-level details
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", error.getDefaultMessage() != null
                                ? sanitizeResponseMessage(error.getDefaultMessage())
                                : "Invalid value"
                ))
                .collect(Collectors.toList());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("code", "VALIDATION_ERROR");
        response.put("message", "Request validation failed");
        response.put("details", fieldErrors);
        response.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles malformed request body or type conversion errors.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_request",
                        "code", "INVALID_REQUEST",
                        "message", "Invalid request format",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles illegal argument exceptions (out-of-range query parameters).
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", "invalid_argument",
                        "code", "INVALID_ARGUMENT",
                        "message", sanitizeResponseMessage(ex.getMessage()),
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Handles all unhandled exceptions.
     *
     * @param ex the exception
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of(
                        "error", "internal_error",
                        "code", "INTERNAL_ERROR",
                        "message", "An unexpected error occurred",
                        "timestamp", Instant.now().toString()
                ));
    }

    /**
     * Sanitizes a value for safe logging to prevent log injection.
     *
     * @param value the value to sanitize
     * @return sanitized value
     */
    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        // Only allow alphanumeric, dot, brackets and underscore
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._\\[\\]]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
