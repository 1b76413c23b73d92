package com.hwapi.core.parser;

/**
 * Parser for one of the bundled hardware databases.
 *
 * <p>A parser turns the full text of a database snapshot into an immutable structure.
 * It runs once, when the owning cache is built, and any failure is fatal for that cache.
 *
 * @param <T> parsed representation
 */
public interface DatabaseParser<T> {

    /**
     * Returns unique identifier for this database.
     *
     * <p>Used in log lines and parse errors (e.g., "pci-ids", "intel-csv").
     *
     * @return database identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this database.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Parses a complete database snapshot.
     *
     * @param source full database text
     * @return parsed database
     * @throws DatabaseParseException if the snapshot does not follow the database grammar
     */
    T parse(String source);
}
