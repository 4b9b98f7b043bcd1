package com.phillippitts.docassist.presentation.exception;

import com.phillippitts.docassist.exception.CandidatesExhaustedException;
import com.phillippitts.docassist.exception.CapabilityUnavailableException;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.CompletionException;
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
    private static final String RETRY_HINT = "service unavailable, try again";

    /**
     * Nothing to run on - model server down or no models installed (HTTP 503).
     */
    @ExceptionHandler(CapabilityUnavailableException.class)
    ResponseEntity<ApiError> handleUnavailable(CapabilityUnavailableException ex) {
        LOG.warn("No capability available for {}", ex.getTaskType());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                RETRY_HINT,
                "No model is available. Check that the model server is running.",
                Instant.now()
            ));
    }

    /**
     * Transient error - every candidate failed, retry possible (HTTP 503).
     */
    @ExceptionHandler(CandidatesExhaustedException.class)
    ResponseEntity<ApiError> handleExhausted(CandidatesExhaustedException ex) {
        LOG.error("All {} candidates failed for {}: {}", ex.getAttempts(), ex.getTaskType(), ex.getFailures());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                RETRY_HINT,
                ex.getAttempts() + " models tried",
                Instant.now()
            ));
    }

    /**
     * Operation cancelled while queued or running (HTTP 409).
     */
    @ExceptionHandler(OperationCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(OperationCancelledException ex) {
        LOG.info("Operation cancelled: category={}, key={}",
                ex.getCategory() == null ? "-" : ex.getCategory().id(),
                LogSanitizer.source(ex.getResourceKey(), 80));
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Operation cancelled",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadInput(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return badRequest("ValidationFailed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("MalformedRequest", "Request body could not be parsed");
    }

    /**
     * Async results may arrive wrapped; dispatch on the cause.
     */
    @ExceptionHandler(CompletionException.class)
    ResponseEntity<ApiError> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof CapabilityUnavailableException e) {
            return handleUnavailable(e);
        }
        if (cause instanceof CandidatesExhaustedException e) {
            return handleExhausted(e);
        }
        if (cause instanceof OperationCancelledException e) {
            return handleCancelled(e);
        }
        if (cause instanceof IllegalArgumentException e) {
            return handleBadInput(e);
        }
        return handleUnexpected(ex);
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

    private static ResponseEntity<ApiError> badRequest(String code, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, "Invalid request", details, Instant.now()));
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
