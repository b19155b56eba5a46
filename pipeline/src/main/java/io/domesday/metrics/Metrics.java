package io.domesday.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String SOURCE_TIME = "pipeline.source.time";
    public static final String TRANSFORM_TIME = "pipeline.transform.time";
    public static final String SINK_TIME = "pipeline.sink.time";
    public static final String INPUT_RATE = "pipeline.input.rate";
    public static final String OUTPUT_RATE = "pipeline.output.rate";
    public static final String ERROR_RATE = "pipeline.error.rate";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
