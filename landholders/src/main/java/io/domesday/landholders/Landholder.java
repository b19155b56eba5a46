package io.domesday.landholders;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A landholder in the PASE Domesday database.
 * <p>
 * The five {@link Hides} fields give the total taxable value of the estates held in whole or part by
 * this person. {@code name}, {@code gender} and {@code editor} are {@code null} when absent.
 */
public record Landholder(
        String name,
        String gender,
        String paseName,
        String description,
        Hides holder1066,
        Hides lord1066,
        Hides demesne1086,
        Hides subtenanted1086,
        Hides subtenant1086,
        String editor,
        String editorialStatus
) {
    public Landholder {
        Objects.requireNonNull(paseName, "paseName");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(holder1066, "holder1066");
        Objects.requireNonNull(lord1066, "lord1066");
        Objects.requireNonNull(demesne1086, "demesne1086");
        Objects.requireNonNull(subtenanted1086, "subtenanted1086");
        Objects.requireNonNull(subtenant1086, "subtenant1086");
        Objects.requireNonNull(editorialStatus, "editorialStatus");
    }

    /** Build from an eleven-field raw row with the default lenient coercion. */
    public static Landholder fromRow(List<String> row) {
        return fromRow(row, CoercionMode.LENIENT);
    }

    /**
     * Clean every field with its rule, then coerce it to its declared kind.
     *
     * @throws MalformedRowException if the row is not exactly {@link LandholderField#COUNT} wide, or a
     *                               decimal does not parse under {@link CoercionMode#STRICT}
     */
    public static Landholder fromRow(List<String> row, CoercionMode mode) {
        if (row.size() != LandholderField.COUNT) {
            throw new MalformedRowException("expected " + LandholderField.COUNT + " fields, got " + row.size());
        }
        String[] v = new String[LandholderField.COUNT];
        for (LandholderField f : LandholderField.values()) {
            v[f.ordinal()] = f.clean(row.get(f.ordinal()));
        }
        return new Landholder(
                v[0],
                v[1],
                v[2],
                v[3],
                decimal(LandholderField.HOLDER_1066, v[4], mode),
                decimal(LandholderField.LORD_1066, v[5], mode),
                decimal(LandholderField.DEMESNE_1086, v[6], mode),
                decimal(LandholderField.SUBTENANTED_1086, v[7], mode),
                decimal(LandholderField.SUBTENANT_1086, v[8], mode),
                v[9],
                v[10]);
    }

    private static Hides decimal(LandholderField field, String text, CoercionMode mode) {
        try {
            return Hides.parse(text, mode);
        } catch (MalformedRowException e) {
            throw new MalformedRowException(field.column() + ": " + e.getMessage());
        }
    }

    /** The value held for a field: a {@link String}, {@code null}, or a {@link Hides}. */
    public Object get(LandholderField field) {
        return switch (field) {
            case NAME -> name;
            case GENDER -> gender;
            case PASE_NAME -> paseName;
            case DESCRIPTION -> description;
            case HOLDER_1066 -> holder1066;
            case LORD_1066 -> lord1066;
            case DEMESNE_1086 -> demesne1086;
            case SUBTENANTED_1086 -> subtenanted1086;
            case SUBTENANT_1086 -> subtenant1086;
            case EDITOR -> editor;
            case EDITORIAL_STATUS -> editorialStatus;
        };
    }

    public Optional<String> optionalName() { return Optional.ofNullable(name); }
    public Optional<String> optionalGender() { return Optional.ofNullable(gender); }
    public Optional<String> optionalEditor() { return Optional.ofNullable(editor); }

    /** True if any decimal field is raw text rather than a number. */
    public boolean hasRawDecimals() {
        return !(holder1066.isNumeric() && lord1066.isNumeric() && demesne1086.isNumeric()
                && subtenanted1086.isNumeric() && subtenant1086.isNumeric());
    }
}
