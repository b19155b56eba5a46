package io.domesday.landholders;

/** Base of the loader's failures. All are unchecked and abort the current load. */
public class DomesdayException extends RuntimeException {
    public DomesdayException(String message) {
        super(message);
    }

    public DomesdayException(String message, Throwable cause) {
        super(message, cause);
    }
}
