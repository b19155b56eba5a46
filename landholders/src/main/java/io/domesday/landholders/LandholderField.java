package io.domesday.landholders;

/**
 * The eleven columns of the landholder extract, in file and table order, each bound to its
 * declared kind and cleaning rule.
 */
public enum LandholderField {
    NAME("name", Kind.OPTIONAL_TEXT, FieldCleaners::nullSentinel),
    GENDER("gender", Kind.OPTIONAL_TEXT, FieldCleaners::nullSentinel),
    PASE_NAME("pase_name", Kind.TEXT, FieldCleaners::collapseWhitespace),
    DESCRIPTION("description", Kind.TEXT, FieldCleaners::trimQuoted),
    HOLDER_1066("holder_1066", Kind.DECIMAL, FieldCleaner.IDENTITY),
    LORD_1066("lord_1066", Kind.DECIMAL, FieldCleaner.IDENTITY),
    DEMESNE_1086("demesne_1086", Kind.DECIMAL, FieldCleaner.IDENTITY),
    SUBTENANTED_1086("subtenanted_1086", Kind.DECIMAL, FieldCleaner.IDENTITY),
    SUBTENANT_1086("subtenant_1086", Kind.DECIMAL, FieldCleaner.IDENTITY),
    EDITOR("editor", Kind.OPTIONAL_TEXT, FieldCleaners::nullSentinel),
    EDITORIAL_STATUS("editorial_status", Kind.TEXT, FieldCleaner.IDENTITY);

    public enum Kind { TEXT, OPTIONAL_TEXT, DECIMAL }

    /** Width of a well-formed row. */
    public static final int COUNT = values().length;

    private final String column;
    private final Kind kind;
    private final FieldCleaner cleaner;

    LandholderField(String column, Kind kind, FieldCleaner cleaner) {
        this.column = column;
        this.kind = kind;
        this.cleaner = cleaner;
    }

    public String column() { return column; }
    public Kind kind() { return kind; }

    public boolean isNullable() {
        return kind == Kind.OPTIONAL_TEXT;
    }

    public String clean(String raw) {
        return cleaner.clean(raw);
    }
}
