package com.phillippitts.apiguard.util;

/** Utility for bounding free-form text (failure reasons, error messages) before it is stored or logged. */
public final class LogSanitizer {

    /** Longest failure reason kept on a breaker or put into an alert. */
    public static final int MAX_REASON_LENGTH = 200;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Describes a throwable as {@code SimpleName: message}, truncated to {@link #MAX_REASON_LENGTH}.
     */
    public static String describe(Throwable t) {
        if (t == null) {
            return "Unknown";
        }
        String message = t.getMessage();
        String text = message == null || message.isBlank()
                ? t.getClass().getSimpleName()
                : t.getClass().getSimpleName() + ": " + message;
        return truncate(text, MAX_REASON_LENGTH);
    }
}
