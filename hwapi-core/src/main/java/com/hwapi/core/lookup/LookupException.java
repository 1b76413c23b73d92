package com.hwapi.core.lookup;

import java.util.Objects;

/**
 * Base class for recoverable lookup failures.
 */
public class LookupException extends Exception {

    private final LookupFailure failure;
    private final String query;

    public LookupException(LookupFailure failure, String query, String message) {
        this(failure, query, message, null);
    }

    public LookupException(LookupFailure failure, String query, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
        this.query = query;
    }

    /**
     * Returns the kind of failure.
     *
     * @return failure kind
     */
    public LookupFailure failure() {
        return failure;
    }

    /**
     * Returns the query as the caller supplied it.
     *
     * @return query text
     */
    public String query() {
        return query;
    }
}
