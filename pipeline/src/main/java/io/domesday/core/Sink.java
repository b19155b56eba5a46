package io.domesday.core;

/**
 * Sink consumes records in ascending order of seq then subSeq.
 */
public interface Sink<T> {
    void accept(Record<T> record) throws Exception;
}
