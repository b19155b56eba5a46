package io.domesday.landholders;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.StringColumn;
import tech.tablesaw.api.Table;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportersTest {
    @TempDir
    Path dir;

    @Test
    void exports_hides_as_numeric_columns() {
        try (LandholderStore store = new LandholderStore(dir.resolve("export.sqlite"))) {
            store.bulkLoad(List.of(
                    List.of("Ælfric", "Male", "Aelfric 1", "d", "2.5", "1", "0", "0", "0", "Jones", "confirmed"),
                    List.of("null", "", "Wulfric 280", "d", "0.20", "n/a", "0", "0", "1.00", "", "unconfirmed")));

            Table frame = Exporters.tablesaw(store).export();

            assertEquals(2, frame.rowCount());
            assertEquals(11, frame.columnCount());
            assertEquals("pase_name", frame.column(2).name());
            assertInstanceOf(DoubleColumn.class, frame.column("holder_1066"));
            assertInstanceOf(StringColumn.class, frame.column("description"));
            assertEquals(2.7, frame.doubleColumn("holder_1066").sum(), 1e-9);
            assertEquals(1, frame.doubleColumn("lord_1066").countMissing());
            assertEquals(1, frame.stringColumn("name").countMissing());
            assertEquals(1, frame.stringColumn("editor").countMissing());
            assertEquals("Aelfric 1", frame.stringColumn("pase_name").get(0));
        }
    }

    @Test
    void export_of_empty_store_has_the_full_schema() {
        try (LandholderStore store = new LandholderStore(dir.resolve("empty.sqlite"))) {
            Table frame = Exporters.tablesaw(store).export();
            assertEquals(0, frame.rowCount());
            assertEquals(11, frame.columnCount());
        }
    }

    @Test
    void missing_analysis_library_is_reported() {
        ClassLoader loader = getClass().getClassLoader();
        assertTrue(Exporters.isAvailable(Exporters.TABLESAW, loader));
        assertFalse(Exporters.isAvailable("org.example.NoSuchFrame", loader));

        var e = assertThrows(UnsupportedExportException.class,
                () -> Exporters.requireCapability("org.example.NoSuchFrame", loader));
        assertInstanceOf(ClassNotFoundException.class, e.getCause());
    }
}
