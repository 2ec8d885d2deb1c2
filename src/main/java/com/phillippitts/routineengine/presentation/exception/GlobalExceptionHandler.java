package com.phillippitts.routineengine.presentation.exception;

import com.phillippitts.routineengine.exception.RoutineNotFoundException;
import com.phillippitts.routineengine.exception.RoutineStoreException;
import com.phillippitts.routineengine.exception.RoutineValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts routine exceptions to HTTP responses with appropriate status codes. Server-side errors
 * are logged in full but never echoed to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid routine definition or update (HTTP 400).
     */
    @ExceptionHandler(RoutineValidationException.class)
    ResponseEntity<ApiError> handleValidation(RoutineValidationException ex) {
        LOG.warn("Invalid routine input: field={}, reason={}", ex.getField(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid routine",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body is not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be read",
                "Send a JSON object matching the routine schema",
                Instant.now()
            ));
    }

    @ExceptionHandler(RoutineNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(RoutineNotFoundException ex) {
        LOG.info("Routine not found: {}", ex.getRoutineId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Routine not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - store unavailable, retry possible (HTTP 503).
     */
    @ExceptionHandler(RoutineStoreException.class)
    ResponseEntity<ApiError> handleStore(RoutineStoreException ex) {
        LOG.error("Routine store failure", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Routine storage temporarily unavailable",
                "Please retry in a few seconds",
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
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
