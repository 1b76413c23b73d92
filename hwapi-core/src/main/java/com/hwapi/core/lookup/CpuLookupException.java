package com.hwapi.core.lookup;

/**
 * Thrown when a CPU name cannot be resolved to a catalog entry.
 */
public class CpuLookupException extends LookupException {

    private CpuLookupException(LookupFailure failure, String query, String message) {
        super(failure, query, message);
    }

    /**
     * The query contains no token that yields a digit-bearing model.
     *
     * @param query CPU name
     * @return exception to throw
     */
    public static CpuLookupException noModel(String query) {
        return new CpuLookupException(LookupFailure.MALFORMED_QUERY, query,
            "No digit-bearing model found in query: " + query);
    }

    /**
     * No catalog entry shares the model number of the query.
     *
     * @param query CPU name
     * @param model model number extracted from the query
     * @return exception to throw
     */
    public static CpuLookupException noMatch(String query, String model) {
        return new CpuLookupException(LookupFailure.NO_MATCH, query,
            "No close matches found for model " + model + " in query: " + query);
    }
}
