package com.hwapi.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a USB lookup. The device is only present if the vendor is.
 *
 * @param vendor matched vendor
 * @param device matched product under the vendor
 */
public record UsbDeviceInfo(
    Optional<UsbVendor> vendor,
    Optional<UsbDevice> device
) {
    /**
     * Compact constructor with validation.
     */
    public UsbDeviceInfo {
        Objects.requireNonNull(vendor, "vendor must not be null");
        Objects.requireNonNull(device, "device must not be null");
        if (vendor.isEmpty() && device.isPresent()) {
            throw new IllegalArgumentException("device requires a vendor");
        }
    }
}
