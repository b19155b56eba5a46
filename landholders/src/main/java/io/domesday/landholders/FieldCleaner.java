package io.domesday.landholders;

/**
 * Normalizes one raw field value. The result is still text; {@code null} means the value is absent.
 */
@FunctionalInterface
public interface FieldCleaner {
    FieldCleaner IDENTITY = value -> value;

    String clean(String value);
}
