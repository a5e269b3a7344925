package com.phillippitts.apiguard.presentation.exception;

import com.phillippitts.apiguard.exception.BudgetExceededException;
import com.phillippitts.apiguard.exception.CircuitOpenException;
import com.phillippitts.apiguard.exception.RateLimitExceededException;
import jakarta.validation.ConstraintViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.Locale;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts governance exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Breaker rejected the call - retry after the recovery timeout (HTTP 503).
     */
    @ExceptionHandler(CircuitOpenException.class)
    ResponseEntity<ApiError> handleCircuitOpen(CircuitOpenException ex) {
        LOG.warn("Circuit open: breaker={}, retryIn={}s", ex.getBreakerName(), ex.getTimeRemaining().toSeconds());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(ex)))
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable, try later",
                String.format(Locale.ROOT, "Service '%s' is failing; retry in %.0f seconds",
                    ex.getBreakerName(), Math.ceil(ex.getTimeRemaining().toMillis() / 1000.0)),
                Instant.now()
            ));
    }

    /**
     * Rate limit hit without waiting - back off (HTTP 429).
     */
    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> handleRateLimited(RateLimitExceededException ex) {
        LOG.warn("Rate limited: provider={}, limit={}, {}/{}",
            ex.getProvider(), ex.getLimitType(), ex.getCurrent(), ex.getLimit());
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable, try later",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Budget ceiling crossed - hard stop for the run (HTTP 402).
     */
    @ExceptionHandler(BudgetExceededException.class)
    ResponseEntity<ApiError> handleBudgetExceeded(BudgetExceededException ex) {
        LOG.error("Budget exceeded: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYMENT_REQUIRED)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Budget limit reached for this run",
                String.format(Locale.ROOT, "Spent $%.2f of $%.2f",
                    ex.getSummary().totalCostUsd(), ex.getBudgetCeiling()),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid parameter (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
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

    private static long retryAfterSeconds(CircuitOpenException ex) {
        return Math.max(1L, (long) Math.ceil(ex.getTimeRemaining().toMillis() / 1000.0));
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
