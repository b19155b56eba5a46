package io.domesday.core;

import java.util.List;

/**
 * Sink that takes a whole batch as one unit of work. Either every record of the batch is
 * persisted or none is.
 */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;

    @Override
    default void accept(Record<T> record) throws Exception {
        acceptBatch(List.of(record));
    }
}
