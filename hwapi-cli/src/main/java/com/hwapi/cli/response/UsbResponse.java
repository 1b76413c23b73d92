package com.hwapi.cli.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hwapi.core.model.UsbDeviceInfo;

/**
 * JSON shape of a USB lookup. A device that did not match is {@code null}.
 *
 * @param vendor matched vendor
 * @param device matched product
 */
public record UsbResponse(
    @JsonProperty("vendor") NamedId vendor,
    @JsonProperty("device") NamedId device
) {
    public static UsbResponse from(UsbDeviceInfo info) {
        return new UsbResponse(
            info.vendor().map(v -> NamedId.of(v.id(), v.name())).orElse(null),
            info.device().map(d -> NamedId.of(d.id(), d.name())).orElse(null));
    }
}
