package io.domesday.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A finite, blocking producer of records in ascending {@code seq} order.
 */
public interface Source<T> extends Closeable {
    /**
     * Read the next record. Returns empty once the source is exhausted; after that
     * {@link #isFinished()} is true.
     */
    Optional<Record<T>> poll() throws IOException;

    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
