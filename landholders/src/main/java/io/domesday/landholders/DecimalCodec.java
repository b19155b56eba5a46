package io.domesday.landholders;

/**
 * Moves {@link Hides} across the storage boundary as text. Nothing on this path goes through
 * {@code double}, so the stored string is exactly the string read back.
 */
public final class DecimalCodec {
    private DecimalCodec() {
    }

    public static String encode(Hides value) {
        return value == null ? null : value.text();
    }

    /** Stored text that no longer parses is returned as raw {@link Hides}, never rejected. */
    public static Hides decode(String stored) {
        if (stored == null) return null;
        return Hides.parse(stored, CoercionMode.LENIENT);
    }
}
