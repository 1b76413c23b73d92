package com.hwapi.cli.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A 16-bit id with its database name, e.g. {@code {"id": "10ec", "name": "Realtek ..."}}.
 *
 * @param id id as four lowercase hex digits, the way the ID databases write it
 * @param name database name
 */
public record NamedId(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name
) {
    public static NamedId of(int id, String name) {
        return new NamedId(String.format("%04x", id), name);
    }
}
