package com.hwapi.core.parser.impl.pcie;

import com.hwapi.core.model.PcieDevice;
import com.hwapi.core.model.PcieSubsystem;
import com.hwapi.core.model.PcieVendor;
import com.hwapi.core.parser.base.AbstractDatabaseParser;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the {@code pci.ids} database maintained at https://pci-ids.ucw.cz/.
 *
 * <p>The file is a three-level tree:
 * <pre>
 * vvvv  vendor name
 * \tdddd  device name
 * \t\tssvv ssdd  subsystem name
 * </pre>
 *
 * <p>The comment header up to the first {@code "0001 "} line is discarded. {@code #} comment
 * lines may appear between records at any level. The vendor list ends at the first blank
 * line or at the first unindented line that does not start with a four-digit hex id; the
 * device class list that follows it is not read.
 *
 * <p>A line whose indentation selects a level is committed to that level: a missing
 * delimiter or non-hex id on it fails the whole parse.
 */
public class PciIdsParser extends AbstractDatabaseParser<List<PcieVendor>> {

    private static final String FIRST_VENDOR = "0001 ";

    @Override
    public String getId() {
        return "pci-ids";
    }

    @Override
    public String getDisplayName() {
        return "PCI ID Database";
    }

    @Override
    public List<PcieVendor> parse(String source) {
        TextCursor cursor = new TextCursor(source);
        try {
            cursor.skipToLineStartingWith(FIRST_VENDOR);
        } catch (TextParseException e) {
            throw parseFailure(cursor, "vendor list not found", e);
        }

        List<PcieVendor> vendors = new ArrayList<>(512);
        while (true) {
            skipComments(cursor);
            if (atBlankLine(cursor)) {
                break;
            }
            if (!cursor.lookingAtHex(4)) {
                log.debug("PCI vendor list ends at line {}", cursor.lineNumber());
                break;
            }
            try {
                vendors.add(readVendor(cursor));
            } catch (TextParseException e) {
                throw parseFailure(cursor, "malformed record", e);
            }
        }
        log.debug("Parsed {} PCI vendors", vendors.size());
        return vendors;
    }

    PcieVendor readVendor(TextCursor cursor) throws TextParseException {
        int id = cursor.takeHex(4);
        cursor.tag("  ");
        String name = cursor.takeLine();

        Map<Integer, PcieDevice> devices = new LinkedHashMap<>();
        while (true) {
            skipComments(cursor);
            if (!cursor.startsWith("\t") || cursor.startsWith("\t\t")) {
                break;
            }
            PcieDevice device = readDevice(cursor);
            PcieDevice previous = devices.put(device.id(), device);
            if (previous != null) {
                log.warn("Duplicate device {} under PCI vendor {}; keeping '{}' over '{}'",
                    String.format("%04x", device.id()), String.format("%04x", id),
                    device.name(), previous.name());
            }
        }
        return new PcieVendor(id, name, devices);
    }

    PcieDevice readDevice(TextCursor cursor) throws TextParseException {
        cursor.tag("\t");
        int id = cursor.takeHex(4);
        cursor.tag("  ");
        String name = cursor.takeLine();

        List<PcieSubsystem> subsystems = new ArrayList<>();
        while (true) {
            skipComments(cursor);
            if (!cursor.startsWith("\t\t")) {
                break;
            }
            subsystems.add(readSubsystem(cursor));
        }
        return new PcieDevice(id, name, subsystems);
    }

    PcieSubsystem readSubsystem(TextCursor cursor) throws TextParseException {
        cursor.tag("\t\t");
        int subvendorId = cursor.takeHex(4);
        cursor.tag(" ");
        int id = cursor.takeHex(4);
        cursor.tag("  ");
        String name = cursor.takeLine();
        return new PcieSubsystem(subvendorId, id, name);
    }
}
