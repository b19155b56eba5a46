package io.domesday.landholders;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.domesday.core.Record;
import io.domesday.core.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Restores rows whose description held an unescaped delimiter (Thorkil 92 and Wulfric 280 in the
 * published extract). Everything between the first three and the last seven fields belongs to the
 * description and is joined back with the delimiter.
 */
public class RowRepair implements Transform<List<String>, List<String>> {
    public static final String ROWS_REPAIRED = "landholders.rows.repaired";

    private static final Logger log = LoggerFactory.getLogger(RowRepair.class);

    static final int DESCRIPTION_INDEX = LandholderField.DESCRIPTION.ordinal();
    static final int TRAILING_FIELDS = LandholderField.COUNT - DESCRIPTION_INDEX - 1;
    static final String DELIMITER = ",";

    private final Counter repaired;

    public RowRepair(MetricRegistry registry) {
        this.repaired = registry.counter(ROWS_REPAIRED);
    }

    @Override
    public List<Record<List<String>>> apply(Record<List<String>> input) {
        List<String> row = input.payload();
        List<String> fixed;
        try {
            fixed = repair(row);
        } catch (MalformedRowException e) {
            throw e.atRow(input.seq());
        }
        if (fixed.size() != row.size()) {
            repaired.inc();
            log.debug("row {}: rejoined {} description fragments for {}", input.seq() + 1,
                    row.size() - TRAILING_FIELDS - DESCRIPTION_INDEX, fixed.get(LandholderField.PASE_NAME.ordinal()));
        }
        return List.of(input.withPayload(fixed));
    }

    /**
     * Return the row reduced to exactly {@link LandholderField#COUNT} fields. Rows of that width come
     * back unchanged.
     *
     * @throws MalformedRowException when the row is too short to repair
     */
    public static List<String> repair(List<String> row) {
        List<String> out = row;
        if (row.size() > LandholderField.COUNT) {
            int tail = row.size() - TRAILING_FIELDS;
            out = new ArrayList<>(LandholderField.COUNT);
            out.addAll(row.subList(0, DESCRIPTION_INDEX));
            out.add(String.join(DELIMITER, row.subList(DESCRIPTION_INDEX, tail)));
            out.addAll(row.subList(tail, row.size()));
        }
        if (out.size() != LandholderField.COUNT) {
            throw new MalformedRowException("expected " + LandholderField.COUNT + " fields, got " + row.size());
        }
        return out;
    }
}
