package com.hwapi.core.parser;

/**
 * Thrown when a bundled database snapshot cannot be parsed.
 *
 * <p>The cache being built cannot serve without its database, so this is unchecked and
 * is expected to abort startup.
 */
public class DatabaseParseException extends RuntimeException {

    /** Line value used when the failing line is not known. */
    public static final int UNKNOWN_LINE = -1;

    private final String databaseId;
    private final int line;

    public DatabaseParseException(String databaseId, int line, String message) {
        this(databaseId, line, message, null);
    }

    public DatabaseParseException(String databaseId, int line, String message, Throwable cause) {
        super(format(databaseId, line, message), cause);
        this.databaseId = databaseId;
        this.line = line;
    }

    /**
     * Returns the id of the database that failed to parse.
     *
     * @return database id
     */
    public String databaseId() {
        return databaseId;
    }

    /**
     * Returns the 1-based line the failure was detected on.
     *
     * @return line number, or {@link #UNKNOWN_LINE}
     */
    public int line() {
        return line;
    }

    private static String format(String databaseId, int line, String message) {
        if (line == UNKNOWN_LINE) {
            return databaseId + ": " + message;
        }
        return databaseId + " line " + line + ": " + message;
    }
}
