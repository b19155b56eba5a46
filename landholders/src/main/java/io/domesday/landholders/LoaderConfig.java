package io.domesday.landholders;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Loader settings: system properties first, then environment variables, then defaults.
 */
public record LoaderConfig(Path database, CoercionMode coercion) {
    public static final String DEFAULT_DATABASE = "domesday.sqlite";

    public static LoaderConfig fromEnv() {
        Path db = Path.of(System.getProperty("domesday.db", System.getenv().getOrDefault("DOMESDAY_DB", DEFAULT_DATABASE)));
        String coercion = System.getProperty("domesday.coercion", System.getenv().getOrDefault("DOMESDAY_COERCION", "LENIENT"));
        return new LoaderConfig(db, CoercionMode.valueOf(coercion.toUpperCase(Locale.ROOT)));
    }

    public LoaderConfig withDatabase(Path db) {
        return db == null ? this : new LoaderConfig(db, coercion);
    }

    public LoaderConfig withCoercion(CoercionMode mode) {
        return mode == null ? this : new LoaderConfig(database, mode);
    }
}
