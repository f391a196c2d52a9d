package com.fintracker.recurring.exceptions;

/**
 * A generation run could not start at all (templates could not be listed).
 * Per-template failures never surface as this exception.
 */
public class RecurringGenerationException extends RuntimeException {
    public RecurringGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
