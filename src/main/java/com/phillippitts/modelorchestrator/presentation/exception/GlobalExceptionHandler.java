package com.phillippitts.modelorchestrator.presentation.exception;

import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.exception.UnsupportedModelException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions at the REST boundary to HTTP responses.
 *
 * Per-model failures never get here; they are part of the summary. Only rejected input (400)
 * and defects (500) do. Internal messages are never returned for 500s.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - rejected request (HTTP 400).
     */
    @ExceptionHandler(InvalidOrchestrationRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidOrchestrationRequestException ex) {
        LOG.warn("Invalid orchestration request: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid orchestration request", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedModelException.class)
    ResponseEntity<ApiError> handleUnsupportedModel(UnsupportedModelException ex) {
        LOG.warn("Unsupported model requested: {}", ex.getModelName());
        return badRequest(ex.getClass().getSimpleName(), "Unsupported model", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return badRequest("ValidationError", "Invalid orchestration request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("MalformedRequest", "Malformed request body", "Expected a JSON object");
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

    private static ResponseEntity<ApiError> badRequest(String errorCode, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, message, details, Instant.now()));
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
