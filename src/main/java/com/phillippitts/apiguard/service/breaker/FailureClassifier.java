package com.phillippitts.apiguard.service.breaker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a throwable raised by a protected call to a {@link FailureKind}.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Default mapping: {@link IllegalArgumentException} is a validation failure; I/O and timeout
     * exceptions (including when wrapped as the direct cause) are transient; everything else
     * is fatal.
     */
    FailureClassifier DEFAULT = throwable -> {
        if (throwable instanceof IllegalArgumentException) {
            return FailureKind.VALIDATION;
        }
        if (isTransient(throwable) || isTransient(throwable == null ? null : throwable.getCause())) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.FATAL;
    };

    /**
     * Classifies a failure.
     *
     * @param throwable failure raised by the protected call (may be null)
     * @return failure kind (never null)
     */
    FailureKind classify(Throwable throwable);

    private static boolean isTransient(Throwable t) {
        return t instanceof IOException
                || t instanceof UncheckedIOException
                || t instanceof TimeoutException;
    }
}
