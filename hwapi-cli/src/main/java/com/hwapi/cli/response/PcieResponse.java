package com.hwapi.cli.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hwapi.core.model.PcieDeviceInfo;
import com.hwapi.core.model.PcieSubsystem;

/**
 * JSON shape of a PCI lookup. Levels that did not match are {@code null}.
 *
 * @param vendor matched vendor
 * @param device matched device
 * @param subsystem matched subsystem
 */
public record PcieResponse(
    @JsonProperty("vendor") NamedId vendor,
    @JsonProperty("device") NamedId device,
    @JsonProperty("subsystem") Subsystem subsystem
) {
    /**
     * @param subvendorId subsystem vendor as four hex digits
     * @param id subsystem id as four hex digits
     * @param name subsystem name
     */
    public record Subsystem(
        @JsonProperty("subvendorId") String subvendorId,
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
    ) {
        static Subsystem of(PcieSubsystem subsystem) {
            return new Subsystem(
                String.format("%04x", subsystem.subvendorId()),
                String.format("%04x", subsystem.id()),
                subsystem.name());
        }
    }

    public static PcieResponse from(PcieDeviceInfo info) {
        return new PcieResponse(
            info.vendor().map(v -> NamedId.of(v.id(), v.name())).orElse(null),
            info.device().map(d -> NamedId.of(d.id(), d.name())).orElse(null),
            info.subsystem().map(Subsystem::of).orElse(null));
    }
}
