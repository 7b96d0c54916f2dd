package com.phillippitts.readaloud.presentation.exception;

import com.phillippitts.readaloud.exception.FetchException;
import com.phillippitts.readaloud.exception.InvalidStateTransitionException;
import com.phillippitts.readaloud.exception.ReadAloudException;
import com.phillippitts.readaloud.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.debug("Session lookup failed: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found", ex.getMessage());
    }

    /**
     * Command not allowed in the session's current state (HTTP 409).
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    ResponseEntity<ApiError> handleInvalidTransition(InvalidStateTransitionException ex) {
        LOG.info("Rejected command: {} -> {}", ex.getFrom(), ex.getTo());
        return error(HttpStatus.CONFLICT, ex, "Command not allowed in state " + ex.getFrom(), ex.getMessage());
    }

    /**
     * Client error - source missing or unreadable (HTTP 400).
     */
    @ExceptionHandler(FetchException.class)
    ResponseEntity<ApiError> handleFetch(FetchException ex) {
        LOG.warn("Source {} could not be opened: {}", ex.getSourceId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Source could not be read", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getAllErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .sorted()
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Pipeline could not accept or run the session; retry possible (HTTP 503).
     */
    @ExceptionHandler(ReadAloudException.class)
    ResponseEntity<ApiError> handleReadAloud(ReadAloudException ex) {
        LOG.error("Read-aloud pipeline error", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Read-aloud service temporarily unavailable",
                "Please retry in a few seconds");
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    private static String describe(ObjectError error) {
        if (error instanceof FieldError field) {
            return field.getField() + ": " + field.getDefaultMessage();
        }
        return error.getDefaultMessage();
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
