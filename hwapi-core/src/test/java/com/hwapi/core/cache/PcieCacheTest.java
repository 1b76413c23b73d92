package com.hwapi.core.cache;

import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.config.HwapiConfig;
import com.hwapi.core.lookup.IdentifierParseException;
import com.hwapi.core.model.PcieDevice;
import com.hwapi.core.model.PcieDeviceInfo;
import com.hwapi.core.model.PcieSubsystem;
import com.hwapi.core.model.PcieVendor;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PcieCache} against the bundled PCI database.
 */
class PcieCacheTest {

    private static PcieCache cache;

    @BeforeAll
    static void loadCache() {
        cache = HardwareDatabases.loadPcie(HwapiConfig.defaults());
    }

    @Test
    void find_renoirBridge_hasNoSubsystems() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_1022&DEV_1633&SUBSYS_14531022&REV_00");

        assertThat(info.vendor()).map(PcieVendor::name).contains("Advanced Micro Devices, Inc. [AMD]");
        assertThat(info.device()).map(PcieDevice::name).contains("Renoir PCIe GPP Bridge");
        assertThat(info.device().orElseThrow().subsystems()).isEmpty();
        assertThat(info.subsystem()).isEmpty();
    }

    @Test
    void find_matchesSubsystemBySubsysId() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_10EC&DEV_8168&SUBSYS_86771043&REV_15\\6&102E3ADF&0&0048020A");

        assertThat(info.subsystem()).map(PcieSubsystem::name).contains("Realtek 8111E on P8P67 series motherboards");
        assertThat(info.subsystem().orElseThrow().subvendorId()).isEqualTo(0x1043);
    }

    @Test
    void find_subsystemAfterComment_isFound() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_10EC&DEV_8168&SUBSYS_512417AA");

        assertThat(info.subsystem()).map(PcieSubsystem::name).contains("ThinkPad E595");
    }

    @Test
    void find_withoutSubsys_neverReturnsSubsystem() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_10EC&DEV_8168&REV_15");

        assertThat(info.device()).isPresent();
        assertThat(info.subsystem()).isEmpty();
    }

    @Test
    void find_unknownDevice_keepsVendor() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_8086&DEV_FFFE&SUBSYS_00000000");

        assertThat(info.vendor()).map(PcieVendor::name).contains("Intel Corporation");
        assertThat(info.device()).isEmpty();
        assertThat(info.subsystem()).isEmpty();
    }

    @Test
    void find_unknownVendor_isEmptyNotError() throws IdentifierParseException {
        PcieDeviceInfo info = cache.find("PCI\\VEN_ABCD&DEV_1234");

        assertThat(info.vendor()).isEmpty();
        assertThat(info.device()).isEmpty();
    }

    @Test
    void find_malformedIdentifier_throws() {
        assertThatThrownBy(() -> cache.find("PCI\\VEN_10EC"))
            .isInstanceOf(IdentifierParseException.class);
    }

    @Test
    void size_countsVendorsBeforeClassList() {
        assertThat(cache.size()).isEqualTo(9);
        assertThat(cache.vendor(0xFFFF)).map(PcieVendor::name).contains("Illegal Vendor ID");
    }
}
