package io.domesday.transform;

import io.domesday.core.Record;
import io.domesday.core.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequentially applies transforms, flattening outputs. The final outputs are reindexed with deterministic subSeq.
 */
public class TransformChain<I, O> implements Transform<I, O> {
    private final List<Transform<?, ?>> stages;

    public TransformChain(List<Transform<?, ?>> stages) {
        if (stages.isEmpty()) throw new IllegalArgumentException("at least one stage required");
        this.stages = List.copyOf(stages);
    }

    /** Two-stage chain with the intermediate type checked at compile time. */
    public static <I, M, O> TransformChain<I, O> of(Transform<I, M> first, Transform<M, O> second) {
        return new TransformChain<>(List.of(first, second));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public List<Record<O>> apply(Record<I> input) throws Exception {
        List<Record<?>> current = List.of(input);
        for (Transform stage : stages) {
            List<Record<?>> next = new ArrayList<>();
            for (Record<?> r : current) {
                List out = stage.apply(r);
                if (out != null) next.addAll(out);
            }
            current = next;
        }
        List<Record<O>> result = new ArrayList<>(current.size());
        int i = 0;
        for (Record<?> r : current) {
            result.add(new Record<>(r.seq(), i++, (O) r.payload()));
        }
        return result;
    }
}
