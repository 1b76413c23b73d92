package com.hwapi.core.identifier;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Numeric key parsed from a PCI hardware id.
 *
 * @param vendorId value of {@code VEN_}
 * @param deviceId value of {@code DEV_}
 * @param subsystemId first four hex digits of {@code SUBSYS_}, if present
 */
public record PcieIdentifier(int vendorId, int deviceId, OptionalInt subsystemId) {

    public PcieIdentifier {
        Objects.requireNonNull(subsystemId, "subsystemId must not be null");
    }
}
