package com.hwapi.cli.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hwapi.core.model.BugcheckCode;

/**
 * JSON shape of a bug check lookup.
 *
 * @param code code in {@code 0x0000000A} form
 * @param name symbolic name
 * @param url documentation page
 */
public record BugcheckResponse(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name,
    @JsonProperty("url") String url
) {
    public static BugcheckResponse from(BugcheckCode code) {
        return new BugcheckResponse(code.hexCode(), code.name(), code.url());
    }
}
