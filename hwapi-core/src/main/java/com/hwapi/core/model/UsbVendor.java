package com.hwapi.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A USB vendor and its products in database order.
 *
 * @param id 16-bit vendor id
 * @param name vendor name
 * @param devices products in database order
 */
public record UsbVendor(
    int id,
    String name,
    List<UsbDevice> devices
) {
    /**
     * Compact constructor with validation.
     */
    public UsbVendor {
        Objects.requireNonNull(name, "name must not be null");
        devices = devices == null ? List.of() : List.copyOf(devices);
    }

    /**
     * Returns the first product with the given id.
     *
     * @param productId product id
     * @return matching product, or empty
     */
    public Optional<UsbDevice> device(int productId) {
        return devices.stream()
            .filter(device -> device.id() == productId)
            .findFirst();
    }
}
