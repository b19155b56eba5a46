package io.domesday.landholders;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.domesday.core.Record;
import io.domesday.core.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns repaired eleven-field rows into cleaned {@link Landholder}s.
 */
public class LandholderParser implements Transform<List<String>, Landholder> {
    public static final String LENIENT_DECIMALS = "landholders.decimals.lenient";

    private static final Logger log = LoggerFactory.getLogger(LandholderParser.class);

    private final CoercionMode mode;
    private final Counter lenient;

    public LandholderParser(CoercionMode mode, MetricRegistry registry) {
        this.mode = mode;
        this.lenient = registry.counter(LENIENT_DECIMALS);
    }

    @Override
    public List<Record<Landholder>> apply(Record<List<String>> input) {
        Landholder landholder;
        try {
            landholder = Landholder.fromRow(input.payload(), mode);
        } catch (MalformedRowException e) {
            throw e.atRow(input.seq());
        }
        if (landholder.hasRawDecimals()) {
            lenient.inc();
            log.warn("row {}: kept non-numeric hides for {}", input.seq() + 1, landholder.paseName());
        }
        return List.of(input.withPayload(landholder));
    }
}
