package io.domesday.landholders;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A taxable value in hides. {@code text} is the value of record and is what gets stored;
 * {@code amount} is its exact decimal reading, or {@code null} for raw text kept under
 * {@link CoercionMode#LENIENT}.
 * <p>
 * Equality is textual, so {@code 1.20} and {@code 1.2} are different values.
 */
public record Hides(String text, BigDecimal amount) {
    public Hides {
        Objects.requireNonNull(text, "text");
    }

    public static Hides of(BigDecimal amount) {
        return new Hides(amount.toString(), amount);
    }

    public static Hides of(String decimal) {
        return of(new BigDecimal(decimal.strip()));
    }

    /** Unparsed text carried through as-is. */
    public static Hides raw(String text) {
        return new Hides(text, null);
    }

    /**
     * Read a cleaned field value. Surrounding whitespace is ignored; the canonical text of the parsed
     * number keeps its scale.
     *
     * @throws MalformedRowException in {@link CoercionMode#STRICT} when the text is not a decimal
     */
    public static Hides parse(String text, CoercionMode mode) {
        try {
            return of(text);
        } catch (NumberFormatException e) {
            if (mode == CoercionMode.STRICT) {
                throw new MalformedRowException("not a decimal: '" + text + "'");
            }
            return raw(text);
        }
    }

    public boolean isNumeric() {
        return amount != null;
    }

    public Optional<BigDecimal> toBigDecimal() {
        return Optional.ofNullable(amount);
    }

    @Override
    public String toString() {
        return text;
    }
}
