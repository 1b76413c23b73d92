package com.hwapi.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hwapi.core.parser.impl.bugcheck.BugcheckTableParser;

import java.util.List;

/**
 * Root configuration for hwapi.
 *
 * <p>Loaded from {@code hwapi.yaml}. Every section and key is optional; anything left out
 * falls back to the bundled databases and default settings.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * databases:
 *   pcie: classpath:databases/pci.ids
 *   usb: /var/lib/hwapi/usb.ids
 *   usbValidPrefixBytes: 703748
 *   intel:
 *     - classpath:databases/intel/chunk-1.csv
 *     - classpath:databases/intel/chunk-2.csv
 *
 * bugcheck:
 *   documentationBaseUrl: "https://learn.microsoft.com/en-us/windows-hardware/drivers/debugger/"
 *
 * cpu:
 *   memoize: true
 *   memoMaxEntries: 4096
 * }</pre>
 *
 * @param databases where each database snapshot is read from
 * @param bugcheck bug check table settings
 * @param cpu CPU resolver settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HwapiConfig(
    @JsonProperty("databases") DatabaseSources databases,
    @JsonProperty("bugcheck") BugcheckSettings bugcheck,
    @JsonProperty("cpu") CpuSettings cpu
) {
    public HwapiConfig {
        databases = databases == null ? DatabaseSources.defaults() : databases;
        bugcheck = bugcheck == null ? BugcheckSettings.defaults() : bugcheck;
        cpu = cpu == null ? CpuSettings.defaults() : cpu;
    }

    /**
     * Creates the default configuration: bundled databases, memoization on.
     *
     * @return default configuration
     */
    public static HwapiConfig defaults() {
        return new HwapiConfig(null, null, null);
    }

    /**
     * Database locations. A location is either {@code classpath:<resource>} or a filesystem path.
     *
     * @param pcie PCI ID database
     * @param usb USB ID database
     * @param usbValidPrefixBytes number of leading bytes of the USB file known to be valid
     *                            text, or null to detect it
     * @param bugcheck bug check Markdown table
     * @param intel Intel CSV export chunks, concatenated in order
     * @param amd AMD JSON export
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatabaseSources(
        @JsonProperty("pcie") String pcie,
        @JsonProperty("usb") String usb,
        @JsonProperty("usbValidPrefixBytes") Integer usbValidPrefixBytes,
        @JsonProperty("bugcheck") String bugcheck,
        @JsonProperty("intel") List<String> intel,
        @JsonProperty("amd") String amd
    ) {
        public static final String DEFAULT_PCIE = "classpath:databases/pci.ids";
        public static final String DEFAULT_USB = "classpath:databases/usb.ids";
        public static final String DEFAULT_BUGCHECK = "classpath:databases/bugcheck-codes.md";
        public static final List<String> DEFAULT_INTEL = List.of(
            "classpath:databases/intel/chunk-1.csv",
            "classpath:databases/intel/chunk-2.csv");
        public static final String DEFAULT_AMD = "classpath:databases/amd.json";

        public DatabaseSources {
            pcie = pcie == null ? DEFAULT_PCIE : pcie;
            usb = usb == null ? DEFAULT_USB : usb;
            bugcheck = bugcheck == null ? DEFAULT_BUGCHECK : bugcheck;
            intel = intel == null ? DEFAULT_INTEL : List.copyOf(intel);
            amd = amd == null ? DEFAULT_AMD : amd;
            if (usbValidPrefixBytes != null && usbValidPrefixBytes < 0) {
                throw new IllegalArgumentException("usbValidPrefixBytes must not be negative");
            }
        }

        public static DatabaseSources defaults() {
            return new DatabaseSources(null, null, null, null, null, null);
        }
    }

    /**
     * Bug check table settings.
     *
     * @param documentationBaseUrl base that relative documentation links are resolved against
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BugcheckSettings(
        @JsonProperty("documentationBaseUrl") String documentationBaseUrl
    ) {
        public BugcheckSettings {
            if (documentationBaseUrl == null || documentationBaseUrl.isBlank()) {
                documentationBaseUrl = BugcheckTableParser.DEFAULT_BASE_URL;
            }
        }

        public static BugcheckSettings defaults() {
            return new BugcheckSettings(null);
        }
    }

    /**
     * CPU resolver settings.
     *
     * @param memoize whether successful resolutions are remembered
     * @param memoMaxEntries upper bound on remembered resolutions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CpuSettings(
        @JsonProperty("memoize") Boolean memoize,
        @JsonProperty("memoMaxEntries") Integer memoMaxEntries
    ) {
        public static final int DEFAULT_MEMO_MAX_ENTRIES = 4096;

        public CpuSettings {
            memoize = memoize == null ? Boolean.TRUE : memoize;
            memoMaxEntries = memoMaxEntries == null ? DEFAULT_MEMO_MAX_ENTRIES : memoMaxEntries;
            if (memoMaxEntries < 0) {
                throw new IllegalArgumentException("memoMaxEntries must not be negative");
            }
        }

        public static CpuSettings defaults() {
            return new CpuSettings(null, null);
        }
    }
}
