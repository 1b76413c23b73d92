package com.hwapi.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A PCI device listed under a {@link PcieVendor}.
 *
 * <p>Subsystems keep their database order and are searched linearly.
 *
 * @param id 16-bit device id
 * @param name device name
 * @param subsystems subsystems in database order
 */
public record PcieDevice(
    int id,
    String name,
    List<PcieSubsystem> subsystems
) {
    /**
     * Compact constructor with validation.
     */
    public PcieDevice {
        Objects.requireNonNull(name, "name must not be null");
        subsystems = subsystems == null ? List.of() : List.copyOf(subsystems);
    }

    /**
     * Returns the first subsystem with the given subsystem id.
     *
     * @param subsystemId subsystem id
     * @return matching subsystem, or empty
     */
    public Optional<PcieSubsystem> subsystem(int subsystemId) {
        return subsystems.stream()
            .filter(subsystem -> subsystem.id() == subsystemId)
            .findFirst();
    }
}
