package com.flagship.pos_core.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to consistent error bodies.
 *
 * Stock and state conflicts are 409, money rule violations 422,
 * malformed requests 400. Anything else is an infrastructure failure (500)
 * that the caller may retry.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(SaleOperationException.class)
    public ResponseEntity<ErrorResponse> handleSaleOperation(SaleOperationException e) {
        HttpStatus status = statusFor(e);
        log.warn("Sale operation rejected: code={}, message={}", e.getCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getCode())
            .message(e.getMessage())
            .details(e.getDetails())
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("NOT_FOUND")
            .message(e.getMessage())
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(clock.instant())
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
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed parameter {}: {}", e.getName(), e.getValue());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_REQUEST")
            .message("Parameter '" + e.getName() + "' is malformed")
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_REQUEST")
            .message("Request body is malformed")
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_REQUEST")
            .message(e.getMessage())
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(clock.instant())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private HttpStatus statusFor(SaleOperationException e) {
        if (e instanceof InsufficientStockException
                || e instanceof ReservationExpiredException
                || e instanceof InvalidStateTransitionException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
