package net.tvcatalog.exception;

/**
 * A parent resource named in the request path does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
