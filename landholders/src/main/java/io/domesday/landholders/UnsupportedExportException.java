package io.domesday.landholders;

/** Export was requested but the analysis library it needs is not on the classpath. */
public class UnsupportedExportException extends DomesdayException {
    public UnsupportedExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
