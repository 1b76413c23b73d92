package com.hwapi.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CpuCommand}.
 */
class CpuCommandTest {

    @TempDir
    Path tempDir;

    private String config() {
        return tempDir.resolve("hwapi.yaml").toString();
    }

    @Test
    void cpu_unquotedWords_areJoinedIntoOneQuery() throws Exception {
        CliRunner.Result result = CliRunner.run("cpu", "-c", config(),
            "Intel(R)", "Core(TM)", "i7", "CPU", "M", "620", "@", "2.67Ghz");

        assertThat(result.exitCode()).isZero();
        JsonNode json = result.json();
        assertThat(json.path("name").asText()).isEqualTo("Intel® Core™ i7-620M Processor");
        assertThat(json.path("attributes").path("Processor Number").asText()).isEqualTo("i7-620M");
    }

    @Test
    void cpu_quotedAmdName_resolves() throws Exception {
        CliRunner.Result result = CliRunner.run("cpu", "-c", config(),
            "AMD Ryzen 5 PRO 4650G with Radeon Graphics");

        assertThat(result.exitCode()).isZero();
        assertThat(result.json().path("name").asText()).isEqualTo("AMD Ryzen™ 5 PRO 4650G");
    }

    @Test
    void cpu_noModelNumber_exitsNotFound() {
        CliRunner.Result result = CliRunner.run("cpu", "-c", config(), "Intel(R)", "Pentium(R)", "CPU");

        assertThat(result.exitCode()).isEqualTo(AbstractLookupCommand.EXIT_NOT_FOUND);
        assertThat(result.err()).contains("Intel(R) Pentium(R) CPU");
    }
}
