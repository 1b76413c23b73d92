package com.hwapi.core.parser.impl.usb;

import com.hwapi.core.model.UsbDevice;
import com.hwapi.core.model.UsbVendor;
import com.hwapi.core.parser.base.AbstractDatabaseParser;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextParseException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the {@code usb.ids} database maintained at http://www.linux-usb.org/.
 *
 * <p>Same layout as {@code pci.ids} with two levels only:
 * <pre>
 * vvvv  vendor name
 * \tpppp  product name
 * </pre>
 * Interface lines ({@code \t\t}) under a product are skipped.
 *
 * <p>Upstream snapshots contain bytes that are not valid UTF-8 after the vendor list, so the
 * raw file goes through {@link #decodeValidPrefix(byte[])} before it is parsed.
 */
public class UsbIdsParser extends AbstractDatabaseParser<List<UsbVendor>> {

    private static final String FIRST_VENDOR = "0001 ";

    private final Integer validPrefixBytes;

    /**
     * Creates a parser that decodes the longest valid UTF-8 prefix of the raw file.
     */
    public UsbIdsParser() {
        this(null);
    }

    /**
     * Creates a parser that decodes at most {@code validPrefixBytes} bytes of the raw file.
     *
     * @param validPrefixBytes known length of the valid text, or null to detect it
     */
    public UsbIdsParser(Integer validPrefixBytes) {
        if (validPrefixBytes != null && validPrefixBytes < 0) {
            throw new IllegalArgumentException("validPrefixBytes must not be negative: " + validPrefixBytes);
        }
        this.validPrefixBytes = validPrefixBytes;
    }

    @Override
    public String getId() {
        return "usb-ids";
    }

    @Override
    public String getDisplayName() {
        return "USB ID Database";
    }

    /**
     * Decodes and parses a raw {@code usb.ids} file.
     *
     * @param raw file bytes
     * @return vendors in file order
     */
    public List<UsbVendor> parse(byte[] raw) {
        return parse(decodeValidPrefix(raw));
    }

    @Override
    public List<UsbVendor> parse(String source) {
        TextCursor cursor = new TextCursor(source);
        try {
            cursor.skipToLineStartingWith(FIRST_VENDOR);
        } catch (TextParseException e) {
            throw parseFailure(cursor, "vendor list not found", e);
        }

        List<UsbVendor> vendors = new ArrayList<>(1024);
        while (true) {
            skipComments(cursor);
            if (atBlankLine(cursor)) {
                break;
            }
            if (!cursor.lookingAtHex(4)) {
                log.debug("USB vendor list ends at line {}", cursor.lineNumber());
                break;
            }
            try {
                vendors.add(readVendor(cursor));
            } catch (TextParseException e) {
                throw parseFailure(cursor, "malformed record", e);
            }
        }
        log.debug("Parsed {} USB vendors", vendors.size());
        return vendors;
    }

    /**
     * Decodes the part of {@code raw} that is known to be valid UTF-8.
     *
     * <p>Decoding stops at the configured byte limit or at the first malformed sequence,
     * whichever comes first. When the text is cut short it is trimmed back to the end of
     * the last complete line.
     *
     * @param raw file bytes
     * @return decoded text
     */
    public String decodeValidPrefix(byte[] raw) {
        int limit = validPrefixBytes == null ? raw.length : Math.min(validPrefixBytes, raw.length);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(raw, 0, limit);
        CharBuffer out = CharBuffer.allocate(limit);

        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        out.flip();
        String text = out.toString();

        if (result.isError()) {
            log.warn("USB database has invalid UTF-8 at byte {}; reading only the text before it", in.position());
        } else if (limit == raw.length) {
            return text;
        }

        int lastNewline = text.lastIndexOf('\n');
        String truncated = lastNewline < 0 ? "" : text.substring(0, lastNewline + 1);
        log.debug("Decoded {} of {} USB database bytes", in.position(), raw.length);
        return truncated;
    }

    UsbVendor readVendor(TextCursor cursor) throws TextParseException {
        int id = cursor.takeHex(4);
        cursor.tag("  ");
        String name = cursor.takeLine();

        List<UsbDevice> devices = new ArrayList<>();
        while (true) {
            skipComments(cursor);
            if (cursor.startsWith("\t\t")) {
                cursor.skipLine();
                continue;
            }
            if (!cursor.startsWith("\t")) {
                break;
            }
            devices.add(readDevice(cursor));
        }
        return new UsbVendor(id, name, devices);
    }

    UsbDevice readDevice(TextCursor cursor) throws TextParseException {
        cursor.tag("\t");
        int id = cursor.takeHex(4);
        cursor.tag("  ");
        String name = cursor.takeLine();
        return new UsbDevice(id, name);
    }
}
