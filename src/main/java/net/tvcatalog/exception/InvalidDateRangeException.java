package net.tvcatalog.exception;

/**
 * {@code start} or {@code end} query parameter is not an ISO-8601 date-time with offset.
 */
public class InvalidDateRangeException extends RuntimeException {

    public InvalidDateRangeException(String message) {
        super(message);
    }
}
