package com.hwapi.core.parser.base;

import com.hwapi.core.parser.DatabaseParseException;
import com.hwapi.core.parser.DatabaseParser;
import com.hwapi.core.parser.text.TextCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for database parsers providing common functionality.
 *
 * <p>This class reduces code duplication across parser implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per parser class)</li>
 *   <li>Comment skipping for the line-oriented grammars ({@link #skipComments(TextCursor)})</li>
 *   <li>Parse failure creation with line numbers ({@link #parseFailure(TextCursor, String, Throwable)})</li>
 * </ul>
 *
 * @param <T> parsed representation
 * @see DatabaseParser
 */
public abstract class AbstractDatabaseParser<T> implements DatabaseParser<T> {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete parser class.
     */
    protected AbstractDatabaseParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Skips any run of {@code #} comment lines at the cursor.
     *
     * <p>Comments may appear between records at any nesting level and never end the
     * enclosing block.
     *
     * @param cursor cursor positioned at the start of a line
     */
    protected void skipComments(TextCursor cursor) {
        while (cursor.startsWith("#")) {
            cursor.skipLine();
        }
    }

    /**
     * Returns whether the cursor sits on an empty line or at end of input.
     *
     * @param cursor cursor positioned at the start of a line
     * @return true if nothing but a line break follows
     */
    protected boolean atBlankLine(TextCursor cursor) {
        return cursor.atEnd() || cursor.startsWith("\n") || cursor.startsWith("\r\n");
    }

    /**
     * Creates a parse failure for the line the cursor is on.
     *
     * @param cursor cursor at the failing position
     * @param message what went wrong
     * @return exception to throw
     */
    protected DatabaseParseException parseFailure(TextCursor cursor, String message) {
        return parseFailure(cursor, message, null);
    }

    /**
     * Creates a parse failure for the line the cursor is on, keeping the low-level cause.
     *
     * @param cursor cursor at the failing position
     * @param message what went wrong
     * @param cause underlying failure, may be null
     * @return exception to throw
     */
    protected DatabaseParseException parseFailure(TextCursor cursor, String message, Throwable cause) {
        String detail = cause == null ? message : message + " (" + cause.getMessage() + ")";
        return new DatabaseParseException(getId(), cursor.lineNumber(), detail, cause);
    }
}
