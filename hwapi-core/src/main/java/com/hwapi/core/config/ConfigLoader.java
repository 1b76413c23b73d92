package com.hwapi.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code hwapi.yaml}.
 *
 * <p>hwapi must start even without a usable config file, since the bundled database
 * snapshots are enough to serve lookups. Every problem with the file is therefore logged
 * and answered with {@link HwapiConfig#defaults()}; only the database loading that follows
 * can fail startup.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HwapiConfig config = ConfigLoader.load(Paths.get("hwapi.yaml"));
 * HardwareDatabases databases = HardwareDatabases.load(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads {@code configPath}, or the defaults if it cannot be used.
     *
     * @param configPath path to {@code hwapi.yaml}
     * @return configuration from the file, or defaults
     */
    public static HwapiConfig load(Path configPath) {
        Optional<HwapiConfig> config = read(configPath);
        if (config.isEmpty()) {
            log.info("Using bundled hardware databases and default settings");
            return HwapiConfig.defaults();
        }
        HwapiConfig loaded = config.get();
        HwapiConfig.DatabaseSources databases = loaded.databases();
        log.info("Loaded {}: pcie={}, usb={}, bugcheck={}, intel={} chunk(s), amd={}",
            configPath, databases.pcie(), databases.usb(), databases.bugcheck(),
            databases.intel().size(), databases.amd());
        return loaded;
    }

    private static Optional<HwapiConfig> read(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("No config file at {}", configPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Config path {} is not a readable file", configPath);
            return Optional.empty();
        }

        log.debug("Reading config from {}", configPath);
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            HwapiConfig config = YAML_MAPPER.readValue(reader, HwapiConfig.class);
            if (config == null) {
                log.warn("Config file {} is empty", configPath);
            }
            return Optional.ofNullable(config);
        } catch (IOException | IllegalArgumentException e) {
            // Covers YAML syntax errors and rejected values such as a negative memoMaxEntries
            log.warn("Ignoring config file {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }
}
