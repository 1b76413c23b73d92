package com.hwapi.core.identifier;

import com.hwapi.core.lookup.IdentifierParseException;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextParseException;

import java.util.OptionalInt;

/**
 * Parses Windows device instance ids into numeric lookup keys.
 *
 * <p>Only the leading fields are read; anything after them ({@code &REV_}, {@code &CC_},
 * instance paths, serial numbers) is ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PcieIdentifier id = DeviceIdentifiers.parsePcie("PCI\\VEN_10EC&DEV_8168&SUBSYS_86771043&REV_15");
 * // vendorId 0x10EC, deviceId 0x8168, subsystemId 0x8677
 * }</pre>
 *
 * @see <a href="https://learn.microsoft.com/en-us/windows-hardware/drivers/install/identifiers-for-pci-devices">PCI identifiers</a>
 * @see <a href="https://learn.microsoft.com/en-us/windows-hardware/drivers/install/standard-usb-identifiers">USB identifiers</a>
 */
public final class DeviceIdentifiers {

    private DeviceIdentifiers() {
        // Utility class
    }

    /**
     * Parses {@code PCI\VEN_vvvv&DEV_dddd[&SUBSYS_ssssxxxx]...}.
     *
     * <p>Of the eight {@code SUBSYS_} digits only the first four (the subsystem id) are
     * read; the sub-vendor id that follows is ignored.
     *
     * @param identifier PCI device id
     * @return parsed key
     * @throws IdentifierParseException if a literal or hex field is missing
     */
    public static PcieIdentifier parsePcie(String identifier) throws IdentifierParseException {
        TextCursor cursor = new TextCursor(identifier);
        try {
            cursor.tag("PCI\\VEN_");
            int vendorId = cursor.takeHex(4);
            cursor.tag("&DEV_");
            int deviceId = cursor.takeHex(4);
            OptionalInt subsystemId = OptionalInt.empty();
            if (cursor.startsWith("&SU")) {
                cursor.tag("&SUBSYS_");
                subsystemId = OptionalInt.of(cursor.takeHex(4));
            }
            return new PcieIdentifier(vendorId, deviceId, subsystemId);
        } catch (TextParseException e) {
            throw new IdentifierParseException(identifier, e);
        }
    }

    /**
     * Parses {@code USB\VID_vvvv&PID_pppp...}.
     *
     * @param identifier USB device id
     * @return parsed key
     * @throws IdentifierParseException if a literal or hex field is missing
     */
    public static UsbIdentifier parseUsb(String identifier) throws IdentifierParseException {
        TextCursor cursor = new TextCursor(identifier);
        try {
            cursor.tag("USB\\VID_");
            int vendorId = cursor.takeHex(4);
            cursor.tag("&PID_");
            int productId = cursor.takeHex(4);
            return new UsbIdentifier(vendorId, productId);
        } catch (TextParseException e) {
            throw new IdentifierParseException(identifier, e);
        }
    }
}
