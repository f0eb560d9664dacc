package com.propertyintel.price.exception;

import com.propertyintel.price.model.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps pipeline failures to HTTP responses. Nothing here retries or substitutes
 * a default prediction; the failure is surfaced as-is.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Missing Parameter", ex.getMessage(), request, null);
    }

    @ExceptionHandler(SourceConnectionException.class)
    public ResponseEntity<ApiError> handleConnection(
            SourceConnectionException ex, HttpServletRequest request) {
        log.error("Data source unreachable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Data Source Unavailable", ex.getMessage(), request, ex);
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ApiError> handleQuery(
            InvalidQueryException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Query", ex.getMessage(), request, ex);
    }

    @ExceptionHandler(SchemaViolationException.class)
    public ResponseEntity<ApiError> handleSchema(
            SchemaViolationException ex, HttpServletRequest request) {
        log.warn("Fetched data rejected by schema: {}", ex.getMessage());
        ApiError body = baseError(HttpStatus.UNPROCESSABLE_ENTITY, "Schema Violation", ex.getMessage(), request, ex)
                .column(ex.getColumn())
                .rejectedValues(ex.getViolatingValues())
                .build();
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler({
            NoPoiFoundException.class,
            DegenerateFeatureException.class,
            UnknownCategoryException.class,
            InsufficientTrainingDataException.class
    })
    public ResponseEntity<ApiError> handleUnpredictable(
            PricePredictionException ex, HttpServletRequest request) {
        log.warn("Prediction not possible: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Prediction Not Possible", ex.getMessage(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, PricePredictionException cause) {
        return ResponseEntity.status(status).body(baseError(status, error, message, request, cause).build());
    }

    private ApiError.ApiErrorBuilder baseError(
            HttpStatus status, String error, String message,
            HttpServletRequest request, PricePredictionException cause) {
        return ApiError.builder()
                .status(status.value())
                .error(error)
                .errorCode(cause != null ? cause.getErrorCode() : null)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now());
    }
}
