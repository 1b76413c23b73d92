package com.hwapi.core.model;

import java.util.Objects;

/**
 * A PCI subsystem listed under a {@link PcieDevice}.
 *
 * @param subvendorId vendor id of the board maker
 * @param id subsystem id
 * @param name subsystem name
 */
public record PcieSubsystem(
    int subvendorId,
    int id,
    String name
) {
    /**
     * Compact constructor with validation.
     */
    public PcieSubsystem {
        Objects.requireNonNull(name, "name must not be null");
    }
}
