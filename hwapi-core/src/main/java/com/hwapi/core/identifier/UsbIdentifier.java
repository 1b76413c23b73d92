package com.hwapi.core.identifier;

/**
 * Numeric key parsed from a USB hardware id.
 *
 * @param vendorId value of {@code VID_}
 * @param productId value of {@code PID_}
 */
public record UsbIdentifier(int vendorId, int productId) {
}
