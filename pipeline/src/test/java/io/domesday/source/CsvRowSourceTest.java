package io.domesday.source;

import io.domesday.core.Record;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvRowSourceTest {
    @Test
    void emits_one_record_per_row_in_order() throws Exception {
        String csv = "a,b,c\r\n" +
                "\"x, y\",,\" padded \"\n" +
                "1,2,3,4\n";
        try (CsvRowSource src = new CsvRowSource(new StringReader(csv))) {
            Record<List<String>> r1 = src.poll().orElseThrow();
            Record<List<String>> r2 = src.poll().orElseThrow();
            Record<List<String>> r3 = src.poll().orElseThrow();
            assertEquals(List.of("a", "b", "c"), r1.payload());
            assertEquals(List.of("x, y", "", " padded "), r2.payload());
            assertEquals(List.of("1", "2", "3", "4"), r3.payload());
            assertEquals(0, r1.seq());
            assertEquals(2, r3.seq());
            assertTrue(src.poll().isEmpty());
            assertTrue(src.isFinished());
            assertEquals(3, src.rowsRead());
        }
    }

    @Test
    void keeps_escaped_quotes_and_non_ascii() throws Exception {
        String csv = "Ælfric,\"held land, \"\"freely\"\"\"\n";
        try (CsvRowSource src = new CsvRowSource(new StringReader(csv))) {
            assertEquals(List.of("Ælfric", "held land, \"freely\""), src.poll().orElseThrow().payload());
        }
    }

    @Test
    void skips_blank_lines() throws Exception {
        try (CsvRowSource src = new CsvRowSource(new StringReader("a\n\nb\n"))) {
            assertEquals(List.of("a"), src.poll().orElseThrow().payload());
            assertEquals(List.of("b"), src.poll().orElseThrow().payload());
            assertTrue(src.poll().isEmpty());
        }
    }
}
