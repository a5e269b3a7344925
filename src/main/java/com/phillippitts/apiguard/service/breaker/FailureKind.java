package com.phillippitts.apiguard.service.breaker;

/**
 * Abstract failure categories a breaker can be told to ignore.
 *
 * <p>Breakers decide exclusion by kind membership rather than by exception class, so business
 * code can report failures that never surfaced as a Java exception (HTTP status, error payload).
 */
public enum FailureKind {

    /** Caller-side problem such as invalid input. Says nothing about the service's health. */
    VALIDATION,

    /** Timeouts, connection resets, 5xx and 429 responses. */
    TRANSIENT,

    /** Anything else: unexpected errors, malformed responses, permanent provider errors. */
    FATAL
}
