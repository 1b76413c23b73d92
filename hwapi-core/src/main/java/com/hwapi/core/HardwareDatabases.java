package com.hwapi.core;

import com.hwapi.core.cache.BugcheckCache;
import com.hwapi.core.cache.CpuCache;
import com.hwapi.core.cache.PcieCache;
import com.hwapi.core.cache.UsbCache;
import com.hwapi.core.config.HwapiConfig;
import com.hwapi.core.model.BugcheckCode;
import com.hwapi.core.model.Cpu;
import com.hwapi.core.model.PcieVendor;
import com.hwapi.core.model.UsbVendor;
import com.hwapi.core.parser.impl.bugcheck.BugcheckTableParser;
import com.hwapi.core.parser.impl.cpu.AmdJsonParser;
import com.hwapi.core.parser.impl.cpu.IntelCsvParser;
import com.hwapi.core.parser.impl.cpu.SlicedCpu;
import com.hwapi.core.parser.impl.pcie.PciIdsParser;
import com.hwapi.core.parser.impl.usb.UsbIdsParser;
import com.hwapi.core.util.DatabaseResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * The four hardware caches, built once at startup and shared read-only for the life of the
 * process.
 *
 * <p>Each cache can also be built on its own with {@link #loadPcie}, {@link #loadUsb},
 * {@link #loadBugcheck} or {@link #loadCpu}.
 *
 * <p>Loading fails fast: an unreadable source throws {@link IllegalStateException} and a
 * malformed one throws {@link com.hwapi.core.parser.DatabaseParseException}.
 */
public final class HardwareDatabases {

    private static final Logger log = LoggerFactory.getLogger(HardwareDatabases.class);

    private final PcieCache pcie;
    private final UsbCache usb;
    private final BugcheckCache bugcheck;
    private final CpuCache cpu;

    public HardwareDatabases(PcieCache pcie, UsbCache usb, BugcheckCache bugcheck, CpuCache cpu) {
        this.pcie = Objects.requireNonNull(pcie, "pcie must not be null");
        this.usb = Objects.requireNonNull(usb, "usb must not be null");
        this.bugcheck = Objects.requireNonNull(bugcheck, "bugcheck must not be null");
        this.cpu = Objects.requireNonNull(cpu, "cpu must not be null");
    }

    /**
     * Builds all four caches.
     *
     * @param config database locations and settings
     * @return loaded databases
     */
    public static HardwareDatabases load(HwapiConfig config) {
        long start = System.nanoTime();
        HardwareDatabases databases = new HardwareDatabases(
            loadPcie(config), loadUsb(config), loadBugcheck(config), loadCpu(config));
        log.info("All hardware databases loaded in {} ms", elapsedMillis(start));
        return databases;
    }

    public static PcieCache loadPcie(HwapiConfig config) {
        long start = System.nanoTime();
        String location = config.databases().pcie();
        List<PcieVendor> vendors = new PciIdsParser().parse(readString(location));
        PcieCache cache = new PcieCache(vendors);
        log.info("Loaded {} PCI vendors from {} in {} ms", cache.size(), location, elapsedMillis(start));
        return cache;
    }

    public static UsbCache loadUsb(HwapiConfig config) {
        long start = System.nanoTime();
        String location = config.databases().usb();
        UsbIdsParser parser = new UsbIdsParser(config.databases().usbValidPrefixBytes());
        List<UsbVendor> vendors = parser.parse(readBytes(location));
        UsbCache cache = new UsbCache(vendors);
        log.info("Loaded {} USB vendors from {} in {} ms", cache.size(), location, elapsedMillis(start));
        return cache;
    }

    public static BugcheckCache loadBugcheck(HwapiConfig config) {
        long start = System.nanoTime();
        String location = config.databases().bugcheck();
        BugcheckTableParser parser = new BugcheckTableParser(config.bugcheck().documentationBaseUrl());
        List<BugcheckCode> codes = parser.parse(readString(location));
        BugcheckCache cache = new BugcheckCache(codes);
        log.info("Loaded {} bug check codes from {} in {} ms", cache.size(), location, elapsedMillis(start));
        return cache;
    }

    public static CpuCache loadCpu(HwapiConfig config) {
        long start = System.nanoTime();
        IntelCsvParser intelParser = new IntelCsvParser();
        List<SlicedCpu> intel = new ArrayList<>();
        for (String chunk : config.databases().intel()) {
            List<SlicedCpu> cpus = intelParser.parse(readString(chunk));
            log.debug("Read {} Intel CPUs from {}", cpus.size(), chunk);
            intel.addAll(cpus);
        }
        List<Cpu> amd = new AmdJsonParser().parse(readString(config.databases().amd()));

        HwapiConfig.CpuSettings settings = config.cpu();
        CpuCache cache = new CpuCache(intel, amd, settings.memoize(), settings.memoMaxEntries());
        log.info("Loaded {} Intel and {} AMD CPUs in {} ms", intel.size(), amd.size(), elapsedMillis(start));
        return cache;
    }

    public PcieCache pcie() {
        return pcie;
    }

    public UsbCache usb() {
        return usb;
    }

    public BugcheckCache bugcheck() {
        return bugcheck;
    }

    public CpuCache cpu() {
        return cpu;
    }

    private static String readString(String location) {
        try {
            return DatabaseResources.readString(location);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read database " + location + ": " + e, e);
        }
    }

    private static byte[] readBytes(String location) {
        try {
            return DatabaseResources.readBytes(location);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read database " + location + ": " + e, e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
