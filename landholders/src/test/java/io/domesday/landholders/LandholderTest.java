package io.domesday.landholders;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LandholderTest {
    static List<String> row(String name, String gender, String paseName, String description,
                            String holder, String editor) {
        return List.of(name, gender, paseName, description, holder, "1", "0", "0", "0", editor, "confirmed");
    }

    @Test
    void cleans_each_field_by_its_rule() {
        Landholder l = Landholder.fromRow(row("Ælfric", "Male", " Aelfric   1 ", "\"held land ‘freely’\"", "2.5", "Jones"));
        assertEquals("Ælfric", l.name());
        assertEquals("Male", l.gender());
        assertEquals("Aelfric 1", l.paseName());
        assertEquals("held land 'freely'", l.description());
        assertEquals(Hides.of("2.5"), l.holder1066());
        assertEquals("Jones", l.editor());
        assertEquals("confirmed", l.editorialStatus());
    }

    @Test
    void sentinels_are_absent_only_for_nullable_fields() {
        List<String> raw = new ArrayList<>(row("NULL", "undefined", "Anon 3", "null", "0", ""));
        raw.set(LandholderField.EDITORIAL_STATUS.ordinal(), "null");
        Landholder l = Landholder.fromRow(raw);
        assertNull(l.name());
        assertNull(l.gender());
        assertNull(l.editor());
        assertTrue(l.optionalEditor().isEmpty());
        assertEquals("null", l.description());
        assertEquals("null", l.editorialStatus());
    }

    @Test
    void decimals_keep_their_scale() {
        Landholder l = Landholder.fromRow(row("A", "M", "A 1", "d", "1.20", "E"));
        assertEquals("1.20", l.holder1066().text());
        assertEquals(new BigDecimal("1.20"), l.holder1066().amount());
        assertNotEquals(Hides.of("1.2"), l.holder1066());
    }

    @Test
    void lenient_coercion_keeps_raw_text() {
        Landholder l = Landholder.fromRow(row("A", "M", "A 1", "d", "n/a", "E"), CoercionMode.LENIENT);
        assertEquals("n/a", l.holder1066().text());
        assertFalse(l.holder1066().isNumeric());
        assertTrue(l.hasRawDecimals());
    }

    @Test
    void strict_coercion_rejects_non_decimals() {
        var e = assertThrows(MalformedRowException.class,
                () -> Landholder.fromRow(row("A", "M", "A 1", "d", "n/a", "E"), CoercionMode.STRICT));
        assertTrue(e.getMessage().contains("holder_1066"), e.getMessage());
    }

    @Test
    void wrong_width_is_malformed() {
        assertThrows(MalformedRowException.class, () -> Landholder.fromRow(List.of("a", "b", "c")));
    }

    @Test
    void get_returns_values_in_field_order() {
        Landholder l = Landholder.fromRow(row("Ælfric", "Male", "Aelfric 1", "d", "2.5", "Jones"));
        assertEquals("Aelfric 1", l.get(LandholderField.PASE_NAME));
        assertEquals(Hides.of("1"), l.get(LandholderField.LORD_1066));
        assertEquals("confirmed", l.get(LandholderField.EDITORIAL_STATUS));
        assertEquals(11, LandholderField.COUNT);
    }
}
