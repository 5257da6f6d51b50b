package com.flow.sync.service.api.advice;

import com.flow.sync.service.api.dto.ApiResponse;
import com.flow.sync.service.exception.MutationValidationException;
import com.flow.sync.service.exception.SyncException;
import com.flow.sync.service.exception.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * Maps every typed sync failure to a stable error code and HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles bean validation errors on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new ValidationError(error.getField(), error.getDefaultMessage()))
                .toList();

        log.warn("Validation error: {}", errors);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", MutationValidationException.CODE,
                        Map.of("errors", errors)));
    }

    /**
     * Handles typed sync failures.
     */
    @ExceptionHandler(SyncException.class)
    public ResponseEntity<ApiResponse<Void>> handleSyncException(SyncException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());

        if (status.is5xxServerError()) {
            log.error("Sync error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Sync error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        Object details = ex.getDetails().isEmpty() ? null : ex.getDetails();
        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), details));
    }

    /**
     * Handles malformed JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadableException(
            HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", MutationValidationException.CODE));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid parameter {}: {}", ex.getName(), ex.getValue());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Invalid value for parameter " + ex.getName(),
                        MutationValidationException.CODE));
    }

    /**
     * Handles resource not found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case "VALIDATION_ERROR" -> HttpStatus.BAD_REQUEST;
            case "FORBIDDEN" -> HttpStatus.FORBIDDEN;
            case "NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "CONFLICT", "DUPLICATE_ID" -> HttpStatus.CONFLICT;
            case "CAPACITY_EXCEEDED" -> HttpStatus.GONE;
            case "REFERENTIAL_INTEGRITY" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "ACTOR_BUSY" -> HttpStatus.TOO_MANY_REQUESTS;
            case "WORKFLOW_UNAVAILABLE" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "MUTATION_TIMEOUT" -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
