package io.domesday.core;

import java.util.Objects;

/**
 * A payload tagged with its position in the input. {@code seq} is the zero-based row index of the
 * source; {@code subSeq} orders the outputs a transform produced from one input.
 */
public final class Record<T> implements Comparable<Record<?>> {
    private final long seq;
    private final int subSeq;
    private final T payload;

    public Record(long seq, int subSeq, T payload) {
        this.seq = seq;
        this.subSeq = subSeq;
        this.payload = payload;
    }

    public static <T> Record<T> of(long seq, T payload) {
        return new Record<>(seq, 0, payload);
    }

    public long seq() { return seq; }
    public int subSeq() { return subSeq; }
    public T payload() { return payload; }

    /** Same position, new payload. */
    public <U> Record<U> withPayload(U newPayload) {
        return new Record<>(seq, subSeq, newPayload);
    }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(this.seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(this.subSeq, o.subSeq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && subSeq == that.subSeq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, subSeq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", subSeq=" + subSeq +
                ", payload=" + payload +
                '}';
    }
}
