package io.domesday.landholders;

/**
 * Materializes the stored landholders as an analysis frame of type {@code F}.
 */
public interface Exporter<F> {
    F export();
}
