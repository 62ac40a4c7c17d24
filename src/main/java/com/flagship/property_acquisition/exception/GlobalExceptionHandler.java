package com.flagship.property_acquisition.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates acquisition failures into HTTP responses.
 *
 * Every {@link AcquisitionException} maps by its category alone:
 * VALIDATION 400, NOT_FOUND 404, CONFLICT and INVALID_STATE 409, UNAVAILABLE 422, INTERNAL 500.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AcquisitionException.class)
    public ResponseEntity<ErrorResponse> handleAcquisitionException(AcquisitionException e) {
        HttpStatus status = statusOf(e.getCategory());
        if (status.is5xxServerError()) {
            log.error("Acquisition operation failed: {}", e.getMessage(), e);
        } else {
            log.warn("Acquisition request rejected ({}): {}", e.getCategory(), e.getMessage());
        }

        ErrorResponse.ErrorResponseBuilder error = ErrorResponse.builder()
            .error(e.getCategory().name())
            .message(status.is5xxServerError() ? "An unexpected error occurred" : e.getMessage())
            .timestamp(Instant.now());
        if (e instanceof ValidationException validation && validation.getField() != null) {
            error.details(Map.of(validation.getField(), e.getMessage()));
        }
        return ResponseEntity.status(status).body(error.build());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error(AcquisitionException.ErrorCategory.VALIDATION.name())
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error(AcquisitionException.ErrorCategory.VALIDATION.name())
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(AcquisitionException.ErrorCategory.VALIDATION.name())
            .message("Malformed request")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Store failure", e);

        ErrorResponse error = ErrorResponse.builder()
            .error(AcquisitionException.ErrorCategory.INTERNAL.name())
            .message("The store is temporarily unavailable, please retry")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error(AcquisitionException.ErrorCategory.INTERNAL.name())
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusOf(AcquisitionException.ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, INVALID_STATE -> HttpStatus.CONFLICT;
            case UNAVAILABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
