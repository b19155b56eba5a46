package io.domesday.landholders;

import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.util.List;

/**
 * Reads the landholder table into a Tablesaw {@link Table}. Text columns become string columns and
 * the five hides columns become double columns ready for aggregation; raw non-numeric hides are
 * missing values there. The exact decimal text stays in the store.
 */
class TablesawExporter implements Exporter<Table> {
    private final LandholderStore store;

    TablesawExporter(LandholderStore store) {
        this.store = store;
    }

    @Override
    public Table export() {
        LandholderField[] fields = LandholderField.values();
        Column<?>[] columns = new Column<?>[fields.length];
        for (LandholderField f : fields) {
            columns[f.ordinal()] = f.kind() == LandholderField.Kind.DECIMAL
                    ? DoubleColumn.create(f.column())
                    : StringColumn.create(f.column());
        }

        List<Landholder> all = store.findAll();
        for (Landholder l : all) {
            for (LandholderField f : fields) {
                Object value = l.get(f);
                if (columns[f.ordinal()] instanceof DoubleColumn d) {
                    Hides h = (Hides) value;
                    if (h.isNumeric()) {
                        d.append(h.amount().doubleValue());
                    } else {
                        d.appendMissing();
                    }
                } else {
                    StringColumn s = (StringColumn) columns[f.ordinal()];
                    if (value == null) {
                        s.appendMissing();
                    } else {
                        s.append((String) value);
                    }
                }
            }
        }
        return Table.create(LandholderSchema.TABLE, columns);
    }
}
