package com.hwapi.core.model;

import java.util.Objects;

/**
 * A USB product listed under a {@link UsbVendor}.
 *
 * @param id 16-bit product id
 * @param name product name
 */
public record UsbDevice(
    int id,
    String name
) {
    /**
     * Compact constructor with validation.
     */
    public UsbDevice {
        Objects.requireNonNull(name, "name must not be null");
    }
}
