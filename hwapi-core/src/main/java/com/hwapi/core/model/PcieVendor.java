package com.hwapi.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A PCI vendor and its devices, keyed by device id.
 *
 * @param id 16-bit vendor id
 * @param name vendor name
 * @param devices devices keyed by id, in database order
 */
public record PcieVendor(
    int id,
    String name,
    Map<Integer, PcieDevice> devices
) {
    /**
     * Compact constructor with validation.
     */
    public PcieVendor {
        Objects.requireNonNull(name, "name must not be null");
        devices = devices == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(devices));
    }

    /**
     * Looks up a device by id.
     *
     * @param deviceId device id
     * @return device, or empty if this vendor has none with that id
     */
    public Optional<PcieDevice> device(int deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }
}
