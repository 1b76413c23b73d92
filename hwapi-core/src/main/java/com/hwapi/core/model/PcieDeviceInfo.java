package com.hwapi.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a PCI lookup. Each level is only present if the level above it is.
 *
 * @param vendor matched vendor
 * @param device matched device under the vendor
 * @param subsystem matched subsystem under the device
 */
public record PcieDeviceInfo(
    Optional<PcieVendor> vendor,
    Optional<PcieDevice> device,
    Optional<PcieSubsystem> subsystem
) {
    /**
     * Compact constructor with validation.
     */
    public PcieDeviceInfo {
        Objects.requireNonNull(vendor, "vendor must not be null");
        Objects.requireNonNull(device, "device must not be null");
        Objects.requireNonNull(subsystem, "subsystem must not be null");
        if (vendor.isEmpty() && device.isPresent()) {
            throw new IllegalArgumentException("device requires a vendor");
        }
        if (device.isEmpty() && subsystem.isPresent()) {
            throw new IllegalArgumentException("subsystem requires a device");
        }
    }
}
