package com.hwapi.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, """
            databases:
              pcie: /srv/hwapi/pci.ids
              usb: /srv/hwapi/usb.ids
              usbValidPrefixBytes: 703748
              bugcheck: /srv/hwapi/bug-check-code-reference2.md
              intel:
                - /srv/hwapi/intel/chunk-1.csv
              amd: /srv/hwapi/amd.json

            bugcheck:
              documentationBaseUrl: "https://docs.example.com/debugger"

            cpu:
              memoize: false
              memoMaxEntries: 16
            """);

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config.databases().pcie()).isEqualTo("/srv/hwapi/pci.ids");
        assertThat(config.databases().usb()).isEqualTo("/srv/hwapi/usb.ids");
        assertThat(config.databases().usbValidPrefixBytes()).isEqualTo(703748);
        assertThat(config.databases().bugcheck()).isEqualTo("/srv/hwapi/bug-check-code-reference2.md");
        assertThat(config.databases().intel()).containsExactly("/srv/hwapi/intel/chunk-1.csv");
        assertThat(config.databases().amd()).isEqualTo("/srv/hwapi/amd.json");
        assertThat(config.bugcheck().documentationBaseUrl()).isEqualTo("https://docs.example.com/debugger");
        assertThat(config.cpu().memoize()).isFalse();
        assertThat(config.cpu().memoMaxEntries()).isEqualTo(16);
    }

    @Test
    void load_exampleConfigShippedWithProject_readsEveryDatabase() {
        Path example = Path.of("..", "hwapi.example.yaml");

        HwapiConfig config = ConfigLoader.load(example);

        assertThat(config.databases().pcie()).isEqualTo("/var/lib/hwapi/pci.ids");
        assertThat(config.databases().usbValidPrefixBytes()).isNull();
        assertThat(config.databases().intel()).hasSize(2);
        assertThat(config.databases().amd()).isEqualTo("/var/lib/hwapi/amd.json");
        assertThat(config.cpu()).isEqualTo(HwapiConfig.CpuSettings.defaults());
    }

    @Test
    void load_partialYaml_fillsMissingKeysWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, """
            databases:
              usb: /srv/hwapi/usb.ids
            """);

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config.databases().usb()).isEqualTo("/srv/hwapi/usb.ids");
        assertThat(config.databases().pcie()).isEqualTo(HwapiConfig.DatabaseSources.DEFAULT_PCIE);
        assertThat(config.databases().usbValidPrefixBytes()).isNull();
        assertThat(config.databases().intel()).isEqualTo(HwapiConfig.DatabaseSources.DEFAULT_INTEL);
        assertThat(config.bugcheck()).isEqualTo(HwapiConfig.BugcheckSettings.defaults());
        assertThat(config.cpu().memoize()).isTrue();
        assertThat(config.cpu().memoMaxEntries()).isEqualTo(HwapiConfig.CpuSettings.DEFAULT_MEMO_MAX_ENTRIES);
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, """
            server:
              port: 8080
            cpu:
              memoMaxEntries: 8
              warmup: true
            """);

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config.cpu().memoMaxEntries()).isEqualTo(8);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        HwapiConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(HwapiConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(HwapiConfig.defaults());
    }

    @Test
    void load_negativeMemoLimit_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, """
            cpu:
              memoMaxEntries: -1
            """);

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config.cpu().memoMaxEntries()).isEqualTo(HwapiConfig.CpuSettings.DEFAULT_MEMO_MAX_ENTRIES);
    }

    @Test
    void load_scalarWhereListExpected_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, """
            databases:
              intel: /srv/hwapi/intel/chunk-1.csv
            """);

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(HwapiConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hwapi.yaml");
        Files.writeString(configFile, "");

        HwapiConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(HwapiConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        HwapiConfig config = ConfigLoader.load(directory);

        assertThat(config).isEqualTo(HwapiConfig.defaults());
    }
}
