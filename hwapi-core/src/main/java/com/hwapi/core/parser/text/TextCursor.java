package com.hwapi.core.parser.text;

import java.util.Objects;

/**
 * A forward-only cursor over immutable source text with the small set of matching
 * primitives the database and identifier grammars are built from.
 *
 * <p>Every primitive either consumes input and returns what it matched, or throws a
 * {@link TextParseException} naming what it expected and leaves the cursor where the
 * failed rule started. Callers that want to try a rule and fall back take a
 * {@link #position()} mark first and {@link #reset(int)} to it on failure.
 *
 * <p><b>Usage Example</b></p>
 * <pre>{@code
 * TextCursor cursor = new TextCursor("\t1633  Renoir PCIe GPP Bridge\n");
 * cursor.tag("\t");
 * int id = cursor.takeHex(4);        // 0x1633
 * cursor.tag("  ");
 * String name = cursor.takeLine();   // "Renoir PCIe GPP Bridge"
 * }</pre>
 *
 * <p>Instances are not thread-safe; create one cursor per parse.
 */
public final class TextCursor {

    private final String source;
    private int position;

    /**
     * Creates a cursor at the start of {@code source}.
     *
     * @param source text to parse
     */
    public TextCursor(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Returns the full source text.
     *
     * @return source
     */
    public String source() {
        return source;
    }

    /**
     * Returns the current character offset.
     *
     * @return offset into the source
     */
    public int position() {
        return position;
    }

    /**
     * Moves the cursor back to a previously recorded position.
     *
     * @param mark a value previously returned by {@link #position()}
     */
    public void reset(int mark) {
        Objects.checkIndex(mark, source.length() + 1);
        this.position = mark;
    }

    /**
     * Returns whether all input has been consumed.
     *
     * @return true at end of input
     */
    public boolean atEnd() {
        return position >= source.length();
    }

    /**
     * Returns the unconsumed remainder of the source.
     *
     * @return remaining text (empty at end of input)
     */
    public String rest() {
        return source.substring(position);
    }

    /**
     * Tests whether the remaining input begins with {@code literal} without consuming it.
     *
     * @param literal text to look for
     * @return true if the input at the cursor matches
     */
    public boolean startsWith(String literal) {
        return source.startsWith(literal, position);
    }

    /**
     * Consumes {@code literal}.
     *
     * @param literal exact text expected at the cursor
     * @throws TextParseException if the input does not start with the literal
     */
    public void tag(String literal) throws TextParseException {
        if (!startsWith(literal)) {
            throw new TextParseException(quote(literal), position);
        }
        position += literal.length();
    }

    /**
     * Consumes exactly {@code count} characters.
     *
     * @param count number of characters
     * @return the consumed characters
     * @throws TextParseException if fewer than {@code count} characters remain
     */
    public String take(int count) throws TextParseException {
        if (source.length() - position < count) {
            throw new TextParseException(count + " characters", position);
        }
        String taken = source.substring(position, position + count);
        position += count;
        return taken;
    }

    /**
     * Consumes exactly {@code digits} hexadecimal digits and returns their value.
     *
     * <p>Only ASCII hex digits are accepted; signs, whitespace and {@code 0x} prefixes are not.
     *
     * @param digits number of hex digits, at most 7
     * @return parsed value
     * @throws TextParseException if the next {@code digits} characters are not all hex digits
     */
    public int takeHex(int digits) throws TextParseException {
        if (digits < 1 || digits > 7) {
            throw new IllegalArgumentException("digits must be between 1 and 7: " + digits);
        }
        if (source.length() - position < digits) {
            throw new TextParseException(digits + " hex digits", position);
        }
        int value = 0;
        for (int i = 0; i < digits; i++) {
            int digit = hexValue(source.charAt(position + i));
            if (digit < 0) {
                throw new TextParseException(digits + " hex digits", position);
            }
            value = (value << 4) | digit;
        }
        position += digits;
        return value;
    }

    /**
     * Tests whether the next {@code digits} characters are hex digits, without consuming them.
     *
     * @param digits number of characters to check
     * @return true if that many hex digits follow the cursor
     */
    public boolean lookingAtHex(int digits) {
        if (source.length() - position < digits) {
            return false;
        }
        for (int i = 0; i < digits; i++) {
            if (!isHexDigit(source.charAt(position + i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether {@code c} is one of {@code 0-9}, {@code a-f} or {@code A-F}.
     *
     * <p>Unlike {@link Character#digit(char, int)}, other Unicode digits and fullwidth
     * letters are rejected.
     *
     * @param c character to test
     * @return true for an ASCII hex digit
     */
    public static boolean isHexDigit(char c) {
        return hexValue(c) >= 0;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    /**
     * Consumes text up to, but not including, the next occurrence of {@code literal}.
     *
     * @param literal terminator to search for
     * @return the consumed text
     * @throws TextParseException if the terminator does not occur in the remaining input
     */
    public String takeUntil(String literal) throws TextParseException {
        int found = source.indexOf(literal, position);
        if (found < 0) {
            throw new TextParseException(quote(literal), position);
        }
        String taken = source.substring(position, found);
        position = found;
        return taken;
    }

    /**
     * Consumes {@code open}, then text up to {@code close}, then {@code close}.
     *
     * @param open opening literal
     * @param close closing literal
     * @return the text between the delimiters
     * @throws TextParseException if either delimiter is missing; the cursor is left unchanged
     */
    public String delimited(String open, String close) throws TextParseException {
        int mark = position;
        try {
            tag(open);
            String inner = takeUntil(close);
            tag(close);
            return inner;
        } catch (TextParseException e) {
            position = mark;
            throw e;
        }
    }

    /**
     * Consumes the rest of the current line and its terminating newline.
     *
     * <p>A final line without a trailing newline is returned as-is.
     *
     * @return line content without the newline
     */
    public String takeLine() {
        return sliceLine().toString();
    }

    /**
     * Like {@link #takeLine()} but returns a view into the source instead of a copy.
     *
     * @return line content without the newline
     */
    public TextSlice sliceLine() {
        int newline = source.indexOf('\n', position);
        int end = newline < 0 ? source.length() : newline;
        TextSlice line = TextSlice.of(source, position, end);
        position = newline < 0 ? end : newline + 1;
        return line;
    }

    /**
     * Discards the rest of the current line and its terminating newline.
     */
    public void skipLine() {
        int newline = source.indexOf('\n', position);
        position = newline < 0 ? source.length() : newline + 1;
    }

    /**
     * Advances to the first line, at or after the cursor, that starts with {@code prefix}.
     *
     * <p>The cursor must currently be at the start of a line.
     *
     * @param prefix text the target line begins with
     * @throws TextParseException if no such line exists
     */
    public void skipToLineStartingWith(String prefix) throws TextParseException {
        if (startsWith(prefix)) {
            return;
        }
        int found = source.indexOf("\n" + prefix, position);
        if (found < 0) {
            throw new TextParseException("a line starting with " + quote(prefix), position);
        }
        position = found + 1;
    }

    /**
     * Returns the 1-based line number of the cursor.
     *
     * @return line number
     */
    public int lineNumber() {
        int line = 1;
        for (int i = 0; i < position && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String quote(String literal) {
        return '"' + literal.replace("\\", "\\\\").replace("\t", "\\t").replace("\n", "\\n") + '"';
    }
}
