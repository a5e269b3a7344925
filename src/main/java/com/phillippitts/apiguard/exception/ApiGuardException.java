package com.phillippitts.apiguard.exception;

/**
 * Base exception for all api-guard specific errors.
 * All governance exceptions extend this class to enable centralized error handling.
 */
public class ApiGuardException extends RuntimeException {

    public ApiGuardException(String message) {
        super(message);
    }

    public ApiGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiGuardException(Throwable cause) {
        super(cause);
    }
}
