package io.domesday.landholders;

import java.time.Duration;

/**
 * Outcome of one committed bulk load. {@code recordsWritten} counts upserts, so a key repeated in
 * the input is counted each time it was written.
 */
public record LoadResult(long rowsRead, long recordsWritten, long rowsRepaired, long lenientDecimals, Duration elapsed) {}
