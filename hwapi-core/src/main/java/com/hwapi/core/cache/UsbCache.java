package com.hwapi.core.cache;

import com.hwapi.core.identifier.DeviceIdentifiers;
import com.hwapi.core.identifier.UsbIdentifier;
import com.hwapi.core.lookup.IdentifierParseException;
import com.hwapi.core.model.UsbDevice;
import com.hwapi.core.model.UsbDeviceInfo;
import com.hwapi.core.model.UsbVendor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * In-memory USB database, searched linearly in file order.
 *
 * <p>Immutable after construction and safe to query from any number of threads.
 */
public class UsbCache {

    private static final Logger log = LoggerFactory.getLogger(UsbCache.class);

    private final List<UsbVendor> vendors;

    public UsbCache(List<UsbVendor> vendors) {
        this.vendors = List.copyOf(vendors);
    }

    /**
     * Looks up a USB device instance id such as {@code USB\VID_046D&PID_C092\6&1D3A4F8&0&2}.
     *
     * @param identifier USB device id
     * @return whatever levels matched
     * @throws IdentifierParseException if the identifier is malformed
     */
    public UsbDeviceInfo find(String identifier) throws IdentifierParseException {
        UsbIdentifier key = DeviceIdentifiers.parseUsb(identifier);
        Optional<UsbVendor> vendor = vendor(key.vendorId());
        Optional<UsbDevice> device = vendor.flatMap(v -> v.device(key.productId()));
        log.debug("USB lookup {} -> vendor={}, device={}", identifier, vendor.isPresent(), device.isPresent());
        return new UsbDeviceInfo(vendor, device);
    }

    /**
     * Returns the first vendor with the given id.
     *
     * @param vendorId 16-bit vendor id
     * @return vendor, or empty
     */
    public Optional<UsbVendor> vendor(int vendorId) {
        return vendors.stream()
            .filter(vendor -> vendor.id() == vendorId)
            .findFirst();
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
