package io.domesday.landholders;

/**
 * What to do with a decimal field whose cleaned text is not a number.
 */
public enum CoercionMode {
    /** Keep the raw text as the stored value. Matches data loaded by earlier releases. */
    LENIENT,
    /** Reject the row with {@link MalformedRowException}. */
    STRICT
}
