package com.taskqueue.core;

import java.util.Locale;

/**
 * Behavior of take/peek when no task is resident. Selected at construction time.
 */
public enum EmptyQueueMode {
    /**
     * Return {@code Optional.empty()} with no error.
     */
    OPTIONAL,

    /**
     * Throw {@link com.taskqueue.exception.EmptyQueueException}.
     */
    STRICT;

    /**
     * Parse a mode name, case-insensitive, accepting dashes for underscores.
     * "non-blocking-optional" and "strict-error" are accepted as aliases.
     *
     * @throws IllegalArgumentException if the name matches no mode
     */
    public static EmptyQueueMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty queue mode cannot be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        return switch (normalized) {
            case "OPTIONAL", "NON_BLOCKING_OPTIONAL", "OPTIONAL_RETURN" -> OPTIONAL;
            case "STRICT", "STRICT_ERROR" -> STRICT;
            default -> throw new IllegalArgumentException("Unknown empty queue mode: " + value);
        };
    }
}
