package net.tvcatalog.exception;

/**
 * Bad, missing or conflicting {@code limit}/{@code offset}/{@code page_info} combination.
 */
public class InvalidPaginationParamsException extends PaginationException {

    public InvalidPaginationParamsException(String message) {
        super(message);
    }
}
