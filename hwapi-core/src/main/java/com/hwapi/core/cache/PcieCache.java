package com.hwapi.core.cache;

import com.hwapi.core.identifier.DeviceIdentifiers;
import com.hwapi.core.identifier.PcieIdentifier;
import com.hwapi.core.lookup.IdentifierParseException;
import com.hwapi.core.model.PcieDevice;
import com.hwapi.core.model.PcieDeviceInfo;
import com.hwapi.core.model.PcieSubsystem;
import com.hwapi.core.model.PcieVendor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory PCI database keyed by vendor id.
 *
 * <p>Immutable after construction and safe to query from any number of threads.
 */
public class PcieCache {

    private static final Logger log = LoggerFactory.getLogger(PcieCache.class);

    private final Map<Integer, PcieVendor> vendors;

    /**
     * Creates a cache over parsed vendors.
     *
     * @param vendors vendors from the PCI database
     */
    public PcieCache(Collection<PcieVendor> vendors) {
        Map<Integer, PcieVendor> byId = new HashMap<>(vendors.size() * 2);
        for (PcieVendor vendor : vendors) {
            if (byId.put(vendor.id(), vendor) != null) {
                log.warn("Duplicate PCI vendor {}; keeping '{}'", String.format("%04x", vendor.id()), vendor.name());
            }
        }
        this.vendors = Map.copyOf(byId);
    }

    /**
     * Looks up a PCI device instance id such as
     * {@code PCI\VEN_10EC&DEV_8168&SUBSYS_86771043&REV_15}.
     *
     * <p>The vendor is looked up first, then the device under it, then the subsystem whose id
     * equals the {@code SUBSYS_} id of the query. Each missing level leaves the deeper ones empty.
     *
     * @param identifier PCI device id
     * @return whatever levels matched
     * @throws IdentifierParseException if the identifier is malformed
     */
    public PcieDeviceInfo find(String identifier) throws IdentifierParseException {
        PcieIdentifier key = DeviceIdentifiers.parsePcie(identifier);
        Optional<PcieVendor> vendor = vendor(key.vendorId());
        Optional<PcieDevice> device = vendor.flatMap(v -> v.device(key.deviceId()));
        Optional<PcieSubsystem> subsystem = Optional.empty();
        if (key.subsystemId().isPresent()) {
            int subsystemId = key.subsystemId().getAsInt();
            subsystem = device.flatMap(d -> d.subsystem(subsystemId));
        }
        log.debug("PCI lookup {} -> vendor={}, device={}, subsystem={}",
            identifier, vendor.isPresent(), device.isPresent(), subsystem.isPresent());
        return new PcieDeviceInfo(vendor, device, subsystem);
    }

    /**
     * Looks up a vendor by id.
     *
     * @param vendorId 16-bit vendor id
     * @return vendor, or empty
     */
    public Optional<PcieVendor> vendor(int vendorId) {
        return Optional.ofNullable(vendors.get(vendorId));
    }

    /**
     * Returns the number of vendors.
     *
     * @return vendor count
     */
    public int size() {
        return vendors.size();
    }
}
