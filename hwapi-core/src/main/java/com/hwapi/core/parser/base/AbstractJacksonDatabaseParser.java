package com.hwapi.core.parser.base;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hwapi.core.parser.DatabaseParseException;

/**
 * Abstract base class for parsers of JSON database exports using Jackson.
 *
 * <p>This class provides a pre-configured mapper and small helpers for walking
 * {@link JsonNode} trees.
 *
 * @param <T> parsed representation
 * @see AbstractDatabaseParser
 */
public abstract class AbstractJacksonDatabaseParser<T> extends AbstractDatabaseParser<T> {

    /**
     * JSON mapper for parsing exports.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    /**
     * Constructor that initializes the JSON mapper.
     */
    protected AbstractJacksonDatabaseParser() {
        super();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Parses JSON content into a tree.
     *
     * @param jsonContent JSON document
     * @return root node
     * @throws DatabaseParseException if the content is not valid JSON
     */
    protected JsonNode readTree(String jsonContent) {
        try {
            return objectMapper.readTree(jsonContent);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location == null ? DatabaseParseException.UNKNOWN_LINE : location.getLineNr();
            throw new DatabaseParseException(getId(), line, "invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Creates a parse failure that has no meaningful line number.
     *
     * @param message what went wrong
     * @return exception to throw
     */
    protected DatabaseParseException parseFailure(String message) {
        return new DatabaseParseException(getId(), DatabaseParseException.UNKNOWN_LINE, message);
    }

    /**
     * Checks if a JsonNode represents an array.
     *
     * @param node JsonNode to check
     * @return true if node is an array
     */
    protected boolean isArray(JsonNode node) {
        return node != null && node.isArray();
    }
}
