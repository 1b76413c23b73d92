package com.hwapi.core.model;

/**
 * CPU catalog a query is resolved against.
 */
public enum CpuVendor {
    INTEL,
    AMD;

    /**
     * Picks the catalog for a free-form CPU name: AMD if the text contains {@code "AMD"},
     * Intel otherwise.
     *
     * @param query CPU name as reported by the system
     * @return catalog vendor
     */
    public static CpuVendor forQuery(String query) {
        return query.contains("AMD") ? AMD : INTEL;
    }
}
