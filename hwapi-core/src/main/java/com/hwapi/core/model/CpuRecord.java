package com.hwapi.core.model;

/**
 * Common view of a CPU catalog entry, whether it owns its strings or points into
 * the source text it was parsed from.
 */
public interface CpuRecord {

    /**
     * Returns the catalog name of the CPU.
     *
     * @return name, e.g. {@code "AMD Ryzen™ 5 3600"}
     */
    CharSequence name();

    /**
     * Returns an owned copy of this entry.
     *
     * @return materialized CPU
     */
    Cpu toCpu();
}
