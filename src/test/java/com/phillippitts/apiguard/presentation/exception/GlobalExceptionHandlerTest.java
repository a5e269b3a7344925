package com.phillippitts.apiguard.presentation.exception;

import com.phillippitts.apiguard.exception.BudgetExceededException;
import com.phillippitts.apiguard.exception.CircuitOpenException;
import com.phillippitts.apiguard.exception.RateLimitExceededException;
import com.phillippitts.apiguard.exception.RateLimitExceededException.LimitType;
import com.phillippitts.apiguard.service.budget.UsageSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesCircuitOpenReturns503WithRetryAfter() {
        CircuitOpenException ex = new CircuitOpenException("openai", Duration.ofMillis(12_300), "timeout");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCircuitOpen(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("13");
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("CircuitOpenException");
        assertThat(response.getBody().message()).isEqualTo("Service temporarily unavailable, try later");
        assertThat(response.getBody().details()).contains("openai").contains("13 seconds");
    }

    @Test
    void verifiesCircuitOpenDoesNotExposeFailureReason() {
        CircuitOpenException ex = new CircuitOpenException("openai", Duration.ZERO, "401 invalid api key sk-secret");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCircuitOpen(ex);

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("sk-secret");
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
    }

    @Test
    void verifiesRateLimitReturns429() {
        RateLimitExceededException ex = new RateLimitExceededException("firecrawl", LimitType.PER_MINUTE, 10, 10);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleRateLimited(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).isEqualTo("Service temporarily unavailable, try later");
    }

    @Test
    void verifiesBudgetExceededReturns402() {
        UsageSummary summary = new UsageSummary(600_000, 0, 1.2, 1, Map.of(), Map.of());

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBudgetExceeded(new BudgetExceededException(summary, 1.0));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().message()).isEqualTo("Budget limit reached for this run");
        assertThat(response.getBody().details()).isEqualTo("Spent $1.20 of $1.00");
    }

    @Test
    void verifiesBadRequestReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("Unknown period 'weekly'"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).contains("weekly");
    }

    @Test
    void verifiesUnexpectedDoesNotExposeInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("db password=hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("hunter2");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
