package io.domesday.source;

import io.domesday.core.Record;
import io.domesday.core.Source;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Emits the elements of an in-memory iterable in iteration order, numbering them from zero.
 */
public class IterableSource<T> implements Source<T> {
    private final Iterator<T> it;
    private long seq = 0;

    public IterableSource(Iterable<T> items) {
        this.it = Objects.requireNonNull(items, "items").iterator();
    }

    @Override
    public Optional<Record<T>> poll() {
        if (!it.hasNext()) return Optional.empty();
        return Optional.of(Record.of(seq++, it.next()));
    }

    @Override
    public boolean isFinished() {
        return !it.hasNext();
    }
}
