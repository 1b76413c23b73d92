package com.hwapi.core;

import com.hwapi.core.cache.BugcheckCache;
import com.hwapi.core.config.HwapiConfig;
import com.hwapi.core.model.BugcheckCode;
import com.hwapi.core.parser.DatabaseParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HardwareDatabases}.
 */
class HardwareDatabasesTest {

    @TempDir
    Path tempDir;

    @Test
    void load_defaults_buildsAllCaches() {
        HardwareDatabases databases = HardwareDatabases.load(HwapiConfig.defaults());

        assertThat(databases.pcie().size()).isEqualTo(9);
        assertThat(databases.usb().size()).isEqualTo(10);
        assertThat(databases.bugcheck().size()).isEqualTo(11);
        assertThat(databases.cpu().memoSize()).isZero();
    }

    @Test
    void loadPcie_missingLocation_throwsIllegalState() {
        HwapiConfig config = new HwapiConfig(
            new HwapiConfig.DatabaseSources(tempDir.resolve("pci.ids").toString(), null, null, null, null, null),
            null, null);

        assertThatThrownBy(() -> HardwareDatabases.loadPcie(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("pci.ids");
    }

    @Test
    void loadUsb_explicitValidPrefix_readsOnlyThatPrefix() throws IOException {
        Path usbIds = tempDir.resolve("usb.ids");
        String valid = """
            0001  Fry's Electronics
            \t7778  Counterfeit flash drive [Kingston]
            0002  Ingram
            """;
        Files.writeString(usbIds, valid + "0003  Club Mac\n");
        HwapiConfig config = new HwapiConfig(
            new HwapiConfig.DatabaseSources(null, usbIds.toString(), valid.length(), null, null, null),
            null, null);

        assertThat(HardwareDatabases.loadUsb(config).size()).isEqualTo(2);
    }

    @Test
    void loadBugcheck_customBaseUrl_isUsedForLinks() {
        HwapiConfig config = new HwapiConfig(
            null, new HwapiConfig.BugcheckSettings("https://docs.example.com/debugger"), null);

        BugcheckCache cache = HardwareDatabases.loadBugcheck(config);

        assertThat(cache.get(0x133L))
            .map(BugcheckCode::url)
            .hasValue("https://docs.example.com/debugger/bug-check-0x133-dpc-watchdog-violation");
    }

    @Test
    void loadCpu_malformedAmdExport_throwsParseException() throws IOException {
        Path amd = tempDir.resolve("amd.json");
        Files.writeString(amd, "{\"rows\": []}");
        HwapiConfig config = new HwapiConfig(
            new HwapiConfig.DatabaseSources(null, null, null, null, null, amd.toString()),
            null, null);

        assertThatThrownBy(() -> HardwareDatabases.loadCpu(config))
            .isInstanceOf(DatabaseParseException.class)
            .satisfies(e -> assertThat(((DatabaseParseException) e).databaseId()).isEqualTo("amd-json"));
    }
}
