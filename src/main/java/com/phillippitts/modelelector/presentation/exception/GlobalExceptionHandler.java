package com.phillippitts.modelelector.presentation.exception;

import com.phillippitts.modelelector.exception.NoBackendAvailableException;
import com.phillippitts.modelelector.exception.PayloadDecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting backend details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * No backend succeeded - transient, retry possible (HTTP 503).
     */
    @ExceptionHandler(NoBackendAvailableException.class)
    ResponseEntity<ApiError> handleNoBackendAvailable(NoBackendAvailableException ex) {
        LOG.error("No backend available: dispatched={}", ex.getDispatched());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Prediction service temporarily unavailable",
                "No model backend answered in time. Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Selected backend answered with something that is not JSON (HTTP 500).
     */
    @ExceptionHandler(PayloadDecodeException.class)
    ResponseEntity<ApiError> handlePayloadDecode(PayloadDecodeException ex) {
        LOG.error("Selected payload could not be decoded: backend={}", ex.getBackendName(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Model backend returned an unreadable prediction",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Client error - feature validation failed (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidFeatures(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Invalid prediction request: {}", fields);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidFeatures",
                "Invalid prediction request",
                fields,
                Instant.now()
            ));
    }

    /**
     * Client error - body is missing, not JSON, or has non-numeric features (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable prediction request: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Invalid prediction request",
                "Request body must be a JSON object with numeric s_l, s_w, p_l, p_w",
                Instant.now()
            ));
    }

    /**
     * Client error - wrong content type (HTTP 415).
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        LOG.warn("Unsupported media type: {}", ex.getContentType());
        return ResponseEntity
            .status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
            .body(new ApiError(
                "UnsupportedMediaType",
                "Invalid prediction request",
                "Content-Type must be application/json",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
