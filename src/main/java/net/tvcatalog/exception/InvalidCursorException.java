package net.tvcatalog.exception;

/**
 * {@code page_info} could not be decoded, carries the wrong version, or does not fit the
 * ordering of the endpoint it was sent to.
 */
public class InvalidCursorException extends PaginationException {

    public static final String DEFAULT_MESSAGE = "page_info is invalid";

    public InvalidCursorException() {
        super(DEFAULT_MESSAGE);
    }
}
