package com.hwapi.cli.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.model.CpuVendor;

/**
 * Record counts of the loaded databases, printed by {@code hwapi list}.
 *
 * @param pcieVendors PCI vendors
 * @param usbVendors USB vendors
 * @param bugcheckCodes bug check codes
 * @param intelCpus Intel catalog entries
 * @param intelIndexed Intel entries with a model number
 * @param amdCpus AMD catalog entries
 * @param amdIndexed AMD entries with a model number
 */
public record DatabaseSummary(
    @JsonProperty("pcieVendors") int pcieVendors,
    @JsonProperty("usbVendors") int usbVendors,
    @JsonProperty("bugcheckCodes") int bugcheckCodes,
    @JsonProperty("intelCpus") int intelCpus,
    @JsonProperty("intelIndexed") int intelIndexed,
    @JsonProperty("amdCpus") int amdCpus,
    @JsonProperty("amdIndexed") int amdIndexed
) {
    public static DatabaseSummary of(HardwareDatabases databases) {
        return new DatabaseSummary(
            databases.pcie().size(),
            databases.usb().size(),
            databases.bugcheck().size(),
            databases.cpu().catalog(CpuVendor.INTEL).size(),
            databases.cpu().catalog(CpuVendor.INTEL).indexSize(),
            databases.cpu().catalog(CpuVendor.AMD).size(),
            databases.cpu().catalog(CpuVendor.AMD).indexSize());
    }
}
