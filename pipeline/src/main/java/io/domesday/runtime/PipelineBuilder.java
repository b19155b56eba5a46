package io.domesday.runtime;

import com.codahale.metrics.MetricRegistry;
import io.domesday.core.Sink;
import io.domesday.core.Source;
import io.domesday.core.Transform;
import io.domesday.metrics.Metrics;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        return new Pipeline<>(source, transform, sink, new Metrics(metricRegistry));
    }
}
