package com.hwapi.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A CPU catalog entry with its spec-sheet attributes.
 *
 * <p>Only attributes that had a non-empty value in the source are present.
 *
 * @param name catalog name
 * @param attributes attribute name to value, in source order
 */
public record Cpu(
    String name,
    Map<String, String> attributes
) implements CpuRecord {
    /**
     * Compact constructor with validation.
     */
    public Cpu {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public Cpu toCpu() {
        return this;
    }
}
