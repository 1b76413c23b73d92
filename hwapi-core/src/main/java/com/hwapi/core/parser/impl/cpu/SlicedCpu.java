package com.hwapi.core.parser.impl.cpu;

import com.hwapi.core.model.Cpu;
import com.hwapi.core.model.CpuRecord;
import com.hwapi.core.parser.text.TextSlice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Intel catalog entry whose name and attributes are views into the export text.
 *
 * @param name catalog name
 * @param attributes attribute label to cell, in export order
 */
public record SlicedCpu(TextSlice name, Map<TextSlice, TextSlice> attributes) implements CpuRecord {

    public SlicedCpu {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public Cpu toCpu() {
        Map<String, String> owned = new LinkedHashMap<>();
        attributes.forEach((label, value) -> owned.put(label.toString(), value.toString()));
        return new Cpu(name.toString(), owned);
    }
}
