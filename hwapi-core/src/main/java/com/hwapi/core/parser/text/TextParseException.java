package com.hwapi.core.parser.text;

/**
 * Raised by {@link TextCursor} when the text at the cursor does not match what a grammar rule expects.
 *
 * <p>Carries the expected literal or field description and the character offset at which
 * matching failed, so callers can report exactly which part of a record was malformed.
 */
public class TextParseException extends Exception {

    private final String expected;
    private final int offset;

    /**
     * Creates a new failure.
     *
     * @param expected description of what was expected (a quoted literal or a field name)
     * @param offset character offset into the source where matching failed
     */
    public TextParseException(String expected, int offset) {
        super("expected " + expected + " at offset " + offset);
        this.expected = expected;
        this.offset = offset;
    }

    /**
     * Returns what the failed rule expected.
     *
     * @return quoted literal or field description
     */
    public String expected() {
        return expected;
    }

    /**
     * Returns the character offset at which matching failed.
     *
     * @return offset into the source text
     */
    public int offset() {
        return offset;
    }
}
