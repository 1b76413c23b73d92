package com.hwapi.core.parser.impl.bugcheck;

import com.hwapi.core.model.BugcheckCode;
import com.hwapi.core.parser.base.AbstractDatabaseParser;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for the Markdown bug check code reference from the Windows driver documentation.
 *
 * <p>Everything before the first {@code "| 0x000"} row is discarded. Each row has the form
 * <pre>
 * | 0x00000001 | [**APC\_INDEX\_MISMATCH**](bug-check-0x1--apc-index-mismatch.md) |
 * </pre>
 * Backslash escapes are removed from the name, and the relative link is resolved against
 * the documentation base URL with its {@code .md} extension dropped. The first line that
 * is not a row ends the table.
 */
public class BugcheckTableParser extends AbstractDatabaseParser<List<BugcheckCode>> {

    /** Where the bug check reference pages are published. */
    public static final String DEFAULT_BASE_URL =
        "https://learn.microsoft.com/en-us/windows-hardware/drivers/debugger/";

    private static final String FIRST_ROW = "| 0x000";

    private static final int MAX_CODE_DIGITS = 16;

    private final String baseUrl;

    public BugcheckTableParser() {
        this(DEFAULT_BASE_URL);
    }

    /**
     * Creates a parser that resolves documentation links against {@code baseUrl}.
     *
     * @param baseUrl documentation base; a trailing {@code /} is added if missing
     */
    public BugcheckTableParser(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public String getId() {
        return "bugcheck-codes";
    }

    @Override
    public String getDisplayName() {
        return "Bug Check Code Reference";
    }

    @Override
    public List<BugcheckCode> parse(String source) {
        TextCursor cursor = new TextCursor(source);
        try {
            cursor.skipToLineStartingWith(FIRST_ROW);
        } catch (TextParseException e) {
            throw parseFailure(cursor, "bug check table not found", e);
        }

        List<BugcheckCode> codes = new ArrayList<>(512);
        while (!cursor.atEnd()) {
            int mark = cursor.position();
            try {
                codes.add(readRow(cursor));
            } catch (TextParseException e) {
                cursor.reset(mark);
                log.debug("Bug check table ends at line {}: {}", cursor.lineNumber(), e.getMessage());
                break;
            }
        }
        log.debug("Parsed {} bug check codes", codes.size());
        return codes;
    }

    BugcheckCode readRow(TextCursor cursor) throws TextParseException {
        cursor.tag("| ");
        int codeOffset = cursor.position();
        String literal = cursor.take(10);
        cursor.tag(" | ");
        String name = cursor.delimited("[**", "**]").replace("\\", "");
        String resource = cursor.delimited("(", ".md)");
        String tail = cursor.takeLine();
        if (!tail.stripTrailing().endsWith("|")) {
            throw new TextParseException("\"|\" at end of row", cursor.position());
        }
        return new BugcheckCode(parseCode(cursor, literal, codeOffset), name, baseUrl + resource);
    }

    private long parseCode(TextCursor cursor, String literal, int offset) {
        String digits = literal.substring(2);
        boolean hex = literal.startsWith("0x")
            && !digits.isEmpty()
            && digits.length() <= MAX_CODE_DIGITS
            && digits.chars().allMatch(c -> TextCursor.isHexDigit((char) c));
        if (!hex) {
            cursor.reset(offset);
            throw parseFailure(cursor, "bug check code is not a hex literal: '" + literal + "'");
        }
        return Long.parseUnsignedLong(digits, 16);
    }
}
