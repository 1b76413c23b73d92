package com.hwapi.core.lookup;

/**
 * Why a lookup produced no result. Both kinds are reported to callers as "not found".
 */
public enum LookupFailure {
    /** The query does not follow its grammar (missing prefix, non-hex field, no model number). */
    MALFORMED_QUERY,
    /** The query is well formed but no database entry corresponds to it. */
    NO_MATCH
}
