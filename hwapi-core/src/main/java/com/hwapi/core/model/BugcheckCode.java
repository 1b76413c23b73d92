package com.hwapi.core.model;

import java.util.Objects;

/**
 * A Windows bugcheck (stop) code.
 *
 * @param code numeric code, read as an unsigned 64-bit value
 * @param name symbolic name, e.g. {@code APC_INDEX_MISMATCH}
 * @param url documentation page for the code
 */
public record BugcheckCode(
    long code,
    String name,
    String url
) {
    /**
     * Compact constructor with validation.
     */
    public BugcheckCode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }

    /**
     * Returns the code in the {@code 0x0000000A} form used by the documentation.
     *
     * @return hex literal with at least eight digits
     */
    public String hexCode() {
        return String.format("0x%08X", code);
    }
}
