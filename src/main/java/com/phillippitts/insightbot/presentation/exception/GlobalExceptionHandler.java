package com.phillippitts.insightbot.presentation.exception;

import com.phillippitts.insightbot.exception.InvalidSettingException;
import com.phillippitts.insightbot.exception.SessionCapacityException;
import com.phillippitts.insightbot.exception.SessionStateException;
import com.phillippitts.insightbot.exception.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
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

    /**
     * Client error - setting value rejected (HTTP 400).
     */
    @ExceptionHandler(InvalidSettingException.class)
    ResponseEntity<ApiError> handleInvalidSetting(InvalidSettingException ex) {
        LOG.warn("Invalid setting: setting={}, reason={}", ex.getSetting(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid " + ex.getSetting(),
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationError",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - unreadable body or malformed identifiers (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Conflict with the guild's session state (HTTP 409).
     */
    @ExceptionHandler(SessionStateException.class)
    ResponseEntity<ApiError> handleSessionState(SessionStateException ex) {
        LOG.info("Session state conflict: guild={}, state={}", ex.getGuildId(), ex.getState());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session state conflict",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Voice transport could not be acquired (HTTP 502).
     */
    @ExceptionHandler(TransportException.class)
    ResponseEntity<ApiError> handleTransport(TransportException ex) {
        LOG.error("Voice transport failed: channel={}", ex.getChannel(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Could not join the voice channel",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - every session slot is in use (HTTP 503).
     */
    @ExceptionHandler(SessionCapacityException.class)
    ResponseEntity<ApiError> handleCapacity(SessionCapacityException ex) {
        LOG.error("Session capacity exhausted: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Too many active sessions",
                "Please retry once another session has stopped",
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

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
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
