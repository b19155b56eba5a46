package io.domesday.landholders;

/** The SQLite store could not be opened, read or written. */
public class StorageException extends DomesdayException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
