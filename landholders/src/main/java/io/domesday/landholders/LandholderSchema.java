package io.domesday.landholders;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DDL and DML for the landholder store. Decimal columns are declared {@code TEXT_DECIMAL}, which
 * has TEXT affinity in SQLite, so leading and trailing zeros survive.
 */
final class LandholderSchema {
    static final String TABLE = "landholders";
    static final String FTS_TABLE = "fts_landholders";
    static final String GENDER_INDEX = "idx_landholders_gender";

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS landholders (
                name              TEXT,
                gender            TEXT,
                pase_name         TEXT NOT NULL PRIMARY KEY,
                description       TEXT NOT NULL,
                holder_1066       TEXT_DECIMAL NOT NULL,
                lord_1066         TEXT_DECIMAL NOT NULL,
                demesne_1086      TEXT_DECIMAL NOT NULL,
                subtenanted_1086  TEXT_DECIMAL NOT NULL,
                subtenant_1086    TEXT_DECIMAL NOT NULL,
                editor            TEXT,
                editorial_status  TEXT NOT NULL
            )""";

    static final String CREATE_FTS = """
            CREATE VIRTUAL TABLE IF NOT EXISTS fts_landholders USING fts4 (
                content="landholders",
                name,
                pase_name,
                description
            )""";

    static final String CREATE_GENDER_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_landholders_gender ON landholders(gender)";

    static final List<String> DDL = List.of(CREATE_TABLE, CREATE_FTS, CREATE_GENDER_INDEX);

    static final String REBUILD_FTS = "INSERT INTO fts_landholders(fts_landholders) VALUES ('rebuild')";

    /** Every column but the key, then the key: binds the same way as {@link #INSERT}. */
    static final List<LandholderField> UPDATE_ORDER = Arrays.stream(LandholderField.values())
            .filter(f -> f != LandholderField.PASE_NAME)
            .collect(Collectors.toList());

    static final String COLUMNS = Arrays.stream(LandholderField.values())
            .map(LandholderField::column)
            .collect(Collectors.joining(", "));

    static final String UPDATE = "UPDATE landholders SET "
            + UPDATE_ORDER.stream().map(f -> f.column() + " = ?").collect(Collectors.joining(", "))
            + " WHERE pase_name = ?";

    static final String INSERT = "INSERT INTO landholders (" + COLUMNS + ") VALUES ("
            + Arrays.stream(LandholderField.values()).map(f -> "?").collect(Collectors.joining(", ")) + ")";

    static final String SELECT_ALL = "SELECT " + COLUMNS + " FROM landholders ORDER BY pase_name";
    static final String SELECT_BY_KEY = "SELECT " + COLUMNS + " FROM landholders WHERE pase_name = ?";
    static final String COUNT = "SELECT COUNT(*) FROM landholders";
    static final String SEARCH =
            "SELECT pase_name FROM fts_landholders WHERE fts_landholders MATCH ? ORDER BY pase_name";

    private LandholderSchema() {
    }
}
