package io.domesday.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.domesday.core.BatchSink;
import io.domesday.core.Record;
import io.domesday.core.Sink;
import io.domesday.core.Source;
import io.domesday.core.Transform;
import io.domesday.metrics.Metrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-source -> single-transform -> single-sink pipeline, run synchronously on the calling thread.
 * <p>
 * The source is drained and every record transformed before anything reaches the sink, so a failing
 * record aborts the run with nothing written. A {@link BatchSink} then receives all outputs as one
 * batch; a plain {@link Sink} receives them one by one in order. The source is closed on every exit path.
 */
public class Pipeline<I, O> {
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    public Pipeline(Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        Objects.requireNonNull(metrics);
        this.sourceTimer = metrics.timer(Metrics.SOURCE_TIME);
        this.transformTimer = metrics.timer(Metrics.TRANSFORM_TIME);
        this.sinkTimer = metrics.timer(Metrics.SINK_TIME);
        this.inMeter = metrics.meter(Metrics.INPUT_RATE);
        this.outMeter = metrics.meter(Metrics.OUTPUT_RATE);
        this.errorMeter = metrics.meter(Metrics.ERROR_RATE);
    }

    public RunSummary run() throws Exception {
        long started = System.nanoTime();
        long in = 0;
        List<Record<O>> outputs = new ArrayList<>();
        try (Source<I> src = source) {
            while (true) {
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = src.poll();
                }
                if (next.isEmpty()) break;
                in++;
                inMeter.mark();
                try (Timer.Context ignored = transformTimer.time()) {
                    outputs.addAll(transform.apply(next.get()));
                } catch (Exception e) {
                    errorMeter.mark();
                    throw e;
                }
            }
        }

        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> batchSink) {
                batchSink.acceptBatch(outputs);
            } else {
                for (Record<O> r : outputs) {
                    sink.accept(r);
                }
            }
        } catch (Exception e) {
            errorMeter.mark();
            throw e;
        }
        outMeter.mark(outputs.size());
        return new RunSummary(in, outputs.size(), Duration.ofNanos(System.nanoTime() - started));
    }
}
