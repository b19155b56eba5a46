package io.domesday.landholders;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class HidesTest {
    @Test
    void parse_ignores_surrounding_whitespace() {
        Hides h = Hides.parse(" 0.50 ", CoercionMode.STRICT);
        assertEquals("0.50", h.text());
        assertEquals(new BigDecimal("0.50"), h.amount());
    }

    @Test
    void codec_round_trips_text_exactly() {
        for (String text : new String[]{"1.20", "0", "0.0", "10.50", "007.5", "1E+3", "-2.250"}) {
            Hides h = Hides.parse(text, CoercionMode.STRICT);
            assertEquals(h, DecimalCodec.decode(DecimalCodec.encode(h)), text);
        }
        assertEquals("1.20", DecimalCodec.encode(Hides.of("1.20")));
    }

    @Test
    void leading_zeros_are_canonicalized_but_scale_kept() {
        assertEquals("7.50", Hides.of("007.50").text());
    }

    @Test
    void raw_values_survive_the_codec() {
        Hides raw = Hides.parse("half a hide", CoercionMode.LENIENT);
        assertEquals(raw, DecimalCodec.decode(DecimalCodec.encode(raw)));
        assertTrue(raw.toBigDecimal().isEmpty());
    }

    @Test
    void codec_passes_null_through() {
        assertNull(DecimalCodec.encode(null));
        assertNull(DecimalCodec.decode(null));
    }
}
