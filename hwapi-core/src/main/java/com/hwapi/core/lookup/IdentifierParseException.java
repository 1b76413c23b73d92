package com.hwapi.core.lookup;

import com.hwapi.core.parser.text.TextParseException;

/**
 * Thrown when a PCI or USB device identifier does not follow its grammar.
 */
public class IdentifierParseException extends LookupException {

    private final String expected;
    private final int offset;

    public IdentifierParseException(String identifier, TextParseException cause) {
        super(LookupFailure.MALFORMED_QUERY, identifier,
            "Malformed identifier '" + identifier + "': " + cause.getMessage(), cause);
        this.expected = cause.expected();
        this.offset = cause.offset();
    }

    /**
     * Returns the literal or field that was expected.
     *
     * @return expected element, e.g. {@code "PCI\\VEN_"} or {@code 4 hex digits}
     */
    public String expected() {
        return expected;
    }

    /**
     * Returns the character offset in the identifier where matching failed.
     *
     * @return offset
     */
    public int offset() {
        return offset;
    }
}
