package io.domesday.landholders;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FieldCleanersTest {
    @ParameterizedTest
    @ValueSource(strings = {"", "null", "NULL", "Null", "undefined", "Undefined", "UNDEFINED"})
    void null_sentinels_become_absent(String sentinel) {
        assertNull(FieldCleaners.nullSentinel(sentinel));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Jones", " ", "  \t", "nil", "None", "NULLS", "Undefined person", " null"})
    void other_values_pass_through_unchanged(String value) {
        assertEquals(value, FieldCleaners.nullSentinel(value));
    }

    @Test
    void null_sentinel_tolerates_null() {
        assertNull(FieldCleaners.nullSentinel(null));
    }

    @Test
    void trim_quoted_strips_whitespace_and_double_quotes_at_the_ends() {
        assertEquals("held land", FieldCleaners.trimQuoted("  \"held land\"  "));
        assertEquals("held land", FieldCleaners.trimQuoted("“held land”"));
        assertEquals("a \"quoted\" word", FieldCleaners.trimQuoted("a \"quoted\" word"));
        assertEquals("", FieldCleaners.trimQuoted(" \"\" "));
    }

    @Test
    void trim_quoted_normalizes_typographic_apostrophes() {
        assertEquals("Ælfric's land 'of old'", FieldCleaners.trimQuoted("Ælfric’s land ‘of old’"));
    }

    @Test
    void collapse_whitespace_normalizes_key_spacing() {
        assertEquals("Aelfric 1", FieldCleaners.collapseWhitespace("  Aelfric   1 "));
        assertEquals("Aelfric 1", FieldCleaners.collapseWhitespace("Aelfric\t\n1"));
        assertEquals("Aelfric 1", FieldCleaners.collapseWhitespace("Aelfric 1"));
        assertEquals("", FieldCleaners.collapseWhitespace("   "));
        assertEquals("Wulfric 280", FieldCleaners.collapseWhitespace("Wulfric 280"));
    }

    @Test
    void identity_leaves_value_alone() {
        assertEquals(" confirmed ", FieldCleaner.IDENTITY.clean(" confirmed "));
    }
}
