package io.domesday.runtime;

import java.time.Duration;

/** Counts from one completed {@link Pipeline#run()}. */
public record RunSummary(long recordsIn, long recordsOut, Duration elapsed) {}
