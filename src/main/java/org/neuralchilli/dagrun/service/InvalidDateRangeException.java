package org.neuralchilli.dagrun.service;

/**
 * Thrown when a backfill date range ends before it starts or contains a date
 * that is not valid ISO {@code yyyy-MM-dd}.
 */
public class InvalidDateRangeException extends RuntimeException {

    public InvalidDateRangeException(String message) {
        super(message);
    }

    public InvalidDateRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
