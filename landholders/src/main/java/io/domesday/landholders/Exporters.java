package io.domesday.landholders;

import tech.tablesaw.api.Table;

/**
 * Entry point for export. Each factory checks that its analysis library can be loaded before
 * handing out an exporter.
 */
public final class Exporters {
    static final String TABLESAW = "tech.tablesaw.api.Table";

    private Exporters() {
    }

    /**
     * @throws UnsupportedExportException if Tablesaw is not on the classpath
     */
    public static Exporter<Table> tablesaw(LandholderStore store) {
        requireCapability(TABLESAW, Exporters.class.getClassLoader());
        return new TablesawExporter(store);
    }

    public static boolean isAvailable(String className, ClassLoader loader) {
        try {
            Class.forName(className, false, loader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    static void requireCapability(String className, ClassLoader loader) {
        try {
            Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnsupportedExportException(
                    "export needs " + className + " on the classpath; add tech.tablesaw:tablesaw-core", e);
        }
    }
}
