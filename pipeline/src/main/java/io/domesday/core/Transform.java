package io.domesday.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Implementations must preserve the input's seq in outputs while assigning subSeq deterministically.
 */
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;

    /** One-to-one transform that keeps the record position. */
    static <I, O> Transform<I, O> map(PayloadFunction<I, O> fn) {
        return r -> List.of(r.withPayload(fn.apply(r.payload())));
    }

    @FunctionalInterface
    interface PayloadFunction<I, O> {
        O apply(I payload) throws Exception;
    }
}
