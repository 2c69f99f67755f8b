package net.tvcatalog.exception;

/**
 * Base type for user-input errors raised while interpreting pagination parameters.
 * Request scoped and never retried; controllers answer them with a 400.
 */
public abstract class PaginationException extends RuntimeException {

    protected PaginationException(String message) {
        super(message);
    }
}
