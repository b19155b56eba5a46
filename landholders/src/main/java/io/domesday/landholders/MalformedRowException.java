package io.domesday.landholders;

/**
 * A raw row that cannot be turned into a {@link Landholder}: wrong width after repair, or a decimal
 * field rejected under {@link CoercionMode#STRICT}.
 */
public class MalformedRowException extends DomesdayException {
    private final long row;

    public MalformedRowException(String message) {
        super(message);
        this.row = -1;
    }

    private MalformedRowException(long row, MalformedRowException cause) {
        super("row " + (row + 1) + ": " + cause.getMessage(), cause);
        this.row = row;
    }

    /** Same failure, located at the given zero-based input row. */
    public MalformedRowException atRow(long row) {
        return this.row >= 0 ? this : new MalformedRowException(row, this);
    }

    /** Zero-based input row, or -1 when not known. */
    public long row() {
        return row;
    }
}
